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

package com.ossert.common.collect;

import java.io.IOException;

/**
 * A remote service counting the questions asked about a project, eg: a Q&amp;A site client.
 * Both bounds are UNIX timestamps and inclusive.
 */
public interface QuestionCountSource {

  /**
   * @return The number of questions asked within the period.
   * @throws IOException if the service could not be queried.
   */
  long questionsCount(long from, long to) throws IOException;

  /**
   * @return The number of questions asked within the period that have no answer.
   * @throws IOException if the service could not be queried.
   */
  long unansweredQuestionsCount(long from, long to) throws IOException;
}
