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

package com.ossert.common.testing.easymock;

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;
import com.google.common.testing.TearDown;
import com.google.common.testing.TearDownStack;

import org.easymock.IMocksControl;
import org.junit.After;
import org.junit.Before;

import static org.easymock.EasyMock.createControl;

/**
 * A baseclass for tests that use EasyMock.  A new {@link IMocksControl control} is set up before
 * each test and the mocks created and replayed with it are verified during tear down.
 */
public abstract class EasyMockTest {
  private final TearDownStack tearDowns = new TearDownStack();

  protected IMocksControl control;

  /**
   * Creates an EasyMock {@link #control} for tests to use that will be automatically
   * {@link IMocksControl#verify() verified} on tear down.
   */
  @Before
  public final void setupEasyMock() {
    control = createControl();
    tearDowns.addTearDown(new TearDown() {
      @Override public void tearDown() {
        control.verify();
      }
    });
  }

  @After
  public final void runTearDowns() {
    tearDowns.runTearDown();
  }

  /**
   * Creates an EasyMock mock with this test's control.
   */
  public <T> T createMock(Class<T> type) {
    Preconditions.checkNotNull(type);
    return control.createMock(type);
  }

  /**
   * Creates a mock of a parameterized type with this test's control, without unchecked
   * conversion warnings at the call site: {@code createMock(new Clazz<List<String>>() {})}.
   */
  public <T> T createMock(Clazz<T> type) {
    Preconditions.checkNotNull(type);
    return type.createMock(control);
  }

  /**
   * A class meant to be sub-classed in order to capture a generic type literal value.
   */
  public abstract static class Clazz<T> extends TypeToken<T> {
    T createMock(IMocksControl control) {
      @SuppressWarnings("unchecked")
      T mock = (T) control.createMock(getRawType());
      return mock;
    }
  }
}
