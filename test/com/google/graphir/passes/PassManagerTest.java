/*
 * Copyright 2026 The GraphIR Authors.
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
 * limitations under the License.
 */

package com.google.graphir.passes;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.graphir.ir.Function;
import com.google.graphir.ir.Graph;
import com.google.graphir.ir.Model;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.Value;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PassManager} and the {@link InPlacePass} contract. */
@RunWith(JUnit4.class)
public final class PassManagerTest extends PassTestCase {

  private final List<String> log = new ArrayList<>();
  private ImmutableList<InPlacePass> passes;
  private int steps;
  private boolean earlyStop;

  /** Records its runs and reports a change for the first {@code changes} of them. */
  private final class RecordingPass extends InPlacePass {
    private final String name;
    private int changes;

    RecordingPass(String name, int changes) {
      this.name = name;
      this.changes = changes;
    }

    @Override
    public PassResult call(Model model) {
      log.add(name);
      boolean modified = changes > 0;
      changes--;
      return new PassResult(model, modified);
    }
  }

  @Before
  public void setUp() {
    log.clear();
    passes = ImmutableList.of();
    steps = 1;
    earlyStop = true;
  }

  @Override
  protected InPlacePass getProcessor() {
    return new PassManager(passes, steps, earlyStop);
  }

  private static Model emptyModel() {
    return new Model(Graph.builder().name("main").build(), IR_VERSION);
  }

  @Test
  public void testRunsPassesInOrder() {
    passes = ImmutableList.of(new RecordingPass("a", 0), new RecordingPass("b", 1));

    PassResult result = apply(emptyModel());

    assertThat(log).containsExactly("a", "b").inOrder();
    assertThat(result.isModified()).isTrue();
  }

  @Test
  public void testStopsEarlyWhenNothingChanges() {
    passes = ImmutableList.of(new RecordingPass("a", 2));
    steps = 5;

    PassResult result = apply(emptyModel());

    assertThat(log).containsExactly("a", "a", "a");
    assertThat(result.isModified()).isTrue();
  }

  @Test
  public void testRunsAllStepsWithoutEarlyStop() {
    passes = ImmutableList.of(new RecordingPass("a", 0));
    steps = 3;
    earlyStop = false;

    PassResult result = apply(emptyModel());

    assertThat(log).hasSize(3);
    assertThat(result.isModified()).isFalse();
  }

  @Test
  public void testStepsMustBePositive() {
    assertThrows(
        IllegalArgumentException.class, () -> new PassManager(ImmutableList.of(), 0, true));
  }

  @Test
  public void testInlinesThroughManager() {
    Function f = addMulFunction("F");
    Value a = Value.named("a");
    Node callF = call(f, "out", a);
    Model model =
        model(mainGraph(ImmutableList.of(a), ImmutableList.of(callF), callF.getOutputs()), f);
    passes = ImmutableList.of(new InlinePass());
    steps = 2;

    PassResult result = apply(model);

    assertThat(result.isModified()).isTrue();
    assertThat(result.getModel()).isSameInstanceAs(model);
    assertThat(opTypes(model.getGraph())).containsExactly("Add", "Mul").inOrder();
  }

  @Test
  public void testFailingRequiresBecomesPreconditionException() {
    InPlacePass pass =
        new InPlacePass() {
          @Override
          public void requires(Model model) {
            throw new IllegalStateException("not ready");
          }

          @Override
          public PassResult call(Model model) {
            throw new AssertionError("must not run");
          }
        };

    PreconditionException e =
        assertThrows(PreconditionException.class, () -> pass.apply(emptyModel()));

    assertThat(e.getType()).isEqualTo(InPlacePass.PRECONDITION_FAILED);
    assertThat(e).hasMessageThat().contains("not ready");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testFailingEnsuresBecomesPostconditionException() {
    InPlacePass pass =
        new InPlacePass() {
          @Override
          public PassResult call(Model model) {
            return new PassResult(model, false);
          }

          @Override
          public void ensures(Model model) {
            throw new IllegalArgumentException("broken");
          }
        };

    PostconditionException e =
        assertThrows(PostconditionException.class, () -> pass.apply(emptyModel()));

    assertThat(e.getType()).isEqualTo(InPlacePass.POSTCONDITION_FAILED);
  }

  @Test
  public void testReturningAnotherModelFails() {
    InPlacePass pass =
        new InPlacePass() {
          @Override
          public PassResult call(Model model) {
            return new PassResult(emptyModel(), true);
          }
        };

    PassException e = assertThrows(PassException.class, () -> pass.apply(emptyModel()));

    assertThat(e.getType()).isEqualTo(InPlacePass.PASS_NOT_IN_PLACE);
  }

  @Test
  public void testResultToString() {
    assertThat(new PassResult(emptyModel(), true).toString())
        .isEqualTo("PassResult{modified=true}");
  }
}
