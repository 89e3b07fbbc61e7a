/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.quint.frontend;

import exm.quint.ast.Construct;
import exm.quint.ast.ConstructTree;
import exm.quint.ast.ConstructWalk;
import exm.quint.common.Logging;
import exm.quint.common.Settings;
import exm.quint.common.exceptions.InvalidOptionException;

/**
 * Lowering of one parse session.
 *
 * A parser driving the session calls {@link #exit(Construct)} for each
 * construct as it completes, children before parents, siblings left to
 * right.  Alternatively a finished tree can be handed to
 * {@link #walk(ConstructTree)}.  Sessions share no mutable state, so
 * independent sessions can run on different threads; a single session is
 * not thread-safe.
 */
public class LoweringSession {
  private static final LoweringEngine ENGINE = new LoweringEngine();

  private final LoweringState state;

  public LoweringSession(boolean checkLeaks) {
    this.state = new LoweringState(checkLeaks);
  }

  public LoweringSession() {
    this(true);
  }

  /**
   * Create a session configured from {@link Settings}, after applying
   * any overriding system properties
   * @throws InvalidOptionException
   */
  public static LoweringSession fromSettings()
                                  throws InvalidOptionException {
    Settings.initQuintProperties();
    boolean checkLeaks = Settings.getBoolean(Settings.CHECK_STACK_LEAKS);
    if (!checkLeaks) {
      Logging.uniqueWarn("Stack leak checks disabled by " +
                         Settings.CHECK_STACK_LEAKS);
    }
    return new LoweringSession(checkLeaks);
  }

  /**
   * Lower one completed construct
   */
  public void exit(Construct c) {
    LogHelper.traceExit(c);
    c.accept(ENGINE, state);
  }

  /**
   * Lower all constructs of a tree in completion order
   */
  public void walk(ConstructTree tree) {
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(0, "lowering tree:\n" + tree.printTree());
    }
    ConstructWalk.walk(Logging.getQuintLogger(), tree, ENGINE, state);
  }

  public LoweringState state() {
    return state;
  }

  public LoweringResult result() {
    return new LoweringResult(state.modules(), state.ids().sourceMap(),
                              state.diagnostics().list(),
                              state.recovery().notes());
  }
}
