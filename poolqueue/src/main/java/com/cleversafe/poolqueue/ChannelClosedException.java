/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.cleversafe.poolqueue;

/**
 * Raised by a blocking or probing operation on a {@link Channel} that has been closed.
 */
public class ChannelClosedException extends IllegalStateException {
  private static final long serialVersionUID = 4137261597209847210L;

  public ChannelClosedException(final String message) {
    super(message);
  }

  public ChannelClosedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
