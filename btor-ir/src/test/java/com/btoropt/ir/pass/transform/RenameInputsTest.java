package com.btoropt.ir.pass.transform;

import com.btoropt.compiler.model.Declaration;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Opcode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.btoropt.ir.TestPrograms.flat;
import static org.assertj.core.api.Assertions.*;

@DisplayName("rename-inputs 测试")
class RenameInputsTest {

    @Test
    @DisplayName("按出现顺序重命名 input")
    void testRenamesInOrder() {
        List<Instruction> before = flat(
                "1 sort bitvec 1",
                "2 input 1 clk",
                "3 state 1 q",
                "4 input 1 en",
                "5 and 1 2 4",
                "6 output 5");
        List<Instruction> after = new RenameInputs().run(before);

        assertThat(after).hasSameSizeAs(before);
        assertThat(((Declaration) after.get(1)).getName()).isEqualTo("inp_0");
        assertThat(((Declaration) after.get(3)).getName()).isEqualTo("inp_1");
        for (int i = 0; i < before.size(); i++) {
            assertThat(after.get(i).getLid()).isEqualTo(before.get(i).getLid());
            if (before.get(i).getOpcode() != Opcode.INPUT) {
                assertThat(after.get(i).structurallyEquals(before.get(i))).isTrue();
            }
        }
    }

    @Test
    @DisplayName("不修改传入的序列")
    void testDoesNotMutateInput() {
        List<Instruction> before = flat("1 sort bitvec 1", "2 input 1 clk");
        new RenameInputs().run(before);
        assertThat(((Declaration) before.get(1)).getName()).isEqualTo("clk");
    }

    @Test
    @DisplayName("没有 input 时原样返回")
    void testNoInputs() {
        List<Instruction> before = flat("1 sort bitvec 1", "2 one 1", "3 bad 2");
        assertThat(new RenameInputs().run(before)).containsExactlyElementsOf(before);
    }
}
