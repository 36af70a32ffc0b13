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

package com.ossert.common.base;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import org.apache.commons.lang.StringUtils;

/**
 * Argument checks complementing {@link com.google.common.base.Preconditions}.
 */
public final class MorePreconditions {

  private static final String ARG_NOT_BLANK_MSG = "Argument cannot be blank";

  private MorePreconditions() {
    // utility
  }

  /**
   * Checks that a string is non-null and holds something other than whitespace.
   *
   * @param argument the argument to validate
   * @return the argument if it is valid
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument is empty or pure whitespace
   */
  public static String checkNotBlank(String argument) {
    Preconditions.checkNotNull(argument, ARG_NOT_BLANK_MSG);
    Preconditions.checkArgument(!StringUtils.isBlank(argument), ARG_NOT_BLANK_MSG);
    return argument;
  }

  /**
   * Checks that an Iterable is non-null and has at least one element.
   *
   * @param argument the argument to validate
   * @param message the exception message template, %s placeholders filled from {@code args}
   * @param args any arguments needed by the message template
   * @return the argument if it is valid
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument has no elements
   */
  public static <S, T extends Iterable<S>> T checkNotBlank(T argument, String message,
      Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!Iterables.isEmpty(argument), message, args);
    return argument;
  }

  /**
   * Checks that an int is zero or greater.
   *
   * @param argument the argument to validate
   * @param name what the argument represents, used in the exception message
   * @return the argument if it is valid
   * @throws IllegalArgumentException if the argument is negative
   */
  public static int checkNonNegative(int argument, String name) {
    Preconditions.checkArgument(argument >= 0, "%s must be non-negative, got %s", name, argument);
    return argument;
  }
}
