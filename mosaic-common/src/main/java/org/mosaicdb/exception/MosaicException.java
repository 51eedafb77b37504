/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.mosaicdb.exception;

/**
 * Checked exception raised for user errors: bad schema, bad policy or bad data.
 * It always aborts the statement which caused it.
 */
public class MosaicException extends Exception implements DefaultMosaicException {
  private static final long serialVersionUID = 2547328461937154382L;

  private final ResultCode code;

  public MosaicException(ResultCode code, String ... args) {
    super(ErrorMessages.getMessage(code, args));
    this.code = code;
  }

  public MosaicException(ResultCode code, Throwable cause) {
    super(cause);
    this.code = code;
  }

  @Override
  public ResultCode getErrorCode() {
    return code;
  }
}
