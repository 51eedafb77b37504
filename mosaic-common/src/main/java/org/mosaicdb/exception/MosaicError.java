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
 * Unrecoverable error. Unlike {@link MosaicException} it indicates a bug or a broken environment.
 */
public class MosaicError extends Error implements DefaultMosaicException {
  private static final long serialVersionUID = 6112530472853816573L;

  private final ResultCode code;

  public MosaicError(ResultCode code) {
    super(ErrorMessages.getMessage(code));
    this.code = code;
  }

  public MosaicError(ResultCode code, Throwable t) {
    super(ErrorMessages.getMessage(code, t.getMessage()), t);
    this.code = code;
  }

  public MosaicError(ResultCode code, String ... args) {
    super(ErrorMessages.getMessage(code, args));
    this.code = code;
  }

  @Override
  public ResultCode getErrorCode() {
    return code;
  }
}
