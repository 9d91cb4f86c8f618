package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class OperationTest {

  @Test
  public void onlyConstantsAndNamesArePushed() {
    assertThat(Operation.pushConstant(2).type()).isEqualTo(Operation.Type.PUSH_VALUE);
    assertThat(Operation.pushName("x").type()).isEqualTo(Operation.Type.PUSH_VALUE);

    assertThrows(
        IllegalArgumentException.class,
        () ->
            Operation.pushValue(
                Value.Struct.ofElements(ImmutableList.of(Value.Constant.of(1)))));
  }

  @Test
  public void rejectsBadOperands() {
    assertThrows(IllegalArgumentException.class, () -> Operation.getOutput(-1));
    assertThrows(IllegalArgumentException.class, () -> Operation.packList(-1));
    assertThrows(
        IllegalArgumentException.class, () -> Operation.setOutput(0, Value.Constant.none()));
  }

  @Test
  public void operandlessOperationsAreShared() {
    assertThat(Operation.splitStruct()).isSameInstanceAs(Operation.splitStruct());
    assertThat(Operation.endOfStatement()).isSameInstanceAs(Operation.endOfStatement());
    assertThat(Operation.getVar("x")).isEqualTo(Operation.getVar("x"));
    assertThat(Operation.getVar("x")).isNotEqualTo(Operation.createVar("x"));
  }
}
