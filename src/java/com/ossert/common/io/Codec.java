// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.ossert.common.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Encodes objects to and decodes them from byte streams.
 *
 * @param <T> The type of object encoded.
 */
public interface Codec<T> {

  /**
   * Writes {@code item} to {@code sink}.  The sink is flushed but not closed.
   *
   * @throws IOException if the item could not be written.
   */
  void serialize(T item, OutputStream sink) throws IOException;

  /**
   * Reads one item from {@code source}.  The source is not closed.
   *
   * @throws IOException if the stream could not be read or held a malformed item.
   */
  T deserialize(InputStream source) throws IOException;
}
