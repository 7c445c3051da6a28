package com.btoropt.ir.pass.validation;

import com.btoropt.compiler.model.Btor2Printer;
import com.btoropt.compiler.model.Instruction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.btoropt.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("check-lid-ordering 测试")
class CheckLidOrderingTest {

    @Test
    @DisplayName("lid 等于位置，操作数随之重连")
    void testRenumbersFromZero() {
        List<Instruction> after = new CheckLidOrdering().run(flat(
                "1 sort bitvec 1",
                "2 input 1 a",
                "3 not 1 2"));
        assertThat(Btor2Printer.print(after)).isEqualTo(text(
                "0 sort bitvec 1",
                "1 input 0 a",
                "2 not 0 1"));
    }

    @Test
    @DisplayName("稀疏且乱序的 lid")
    void testSparseLids() {
        List<Instruction> after = new CheckLidOrdering().run(flat(
                "10 sort bitvec 8",
                "40 input 10 x",
                "20 input 10 y",
                "99 add 10 40 20",
                "7 output 99"));
        for (int i = 0; i < after.size(); i++) {
            assertThat(after.get(i).getLid()).isEqualTo(i);
        }
        assertThat(after.get(3).getOperands()).containsExactly(0, 1, 2);
        assertThat(after.get(4).getOperands()).containsExactly(3);
    }
}
