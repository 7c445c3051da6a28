package com.btoropt.ir.miter;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.Btor2Printer;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Opcode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.btoropt.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("MiterBuilder 测试")
class MiterBuilderTest {

    private static final List<Instruction> ADDER = flat(
            "1 sort bitvec 4",
            "2 input 1 a",
            "3 input 1 b",
            "4 add 1 2 3",
            "5 output 4");

    @Test
    @DisplayName("按名字共享输入并比较输出")
    void testMerge() {
        List<Instruction> other = flat(
                "1 sort bitvec 4",
                "2 input 1 b",
                "3 input 1 a",
                "4 add 1 3 2",
                "5 output 4");

        List<Instruction> miter = MiterBuilder.merge(ADDER, other);

        assertThat(Btor2Printer.print(miter)).isEqualTo(text(
                "1 sort bitvec 4",
                "2 input 1 a",
                "3 input 1 b",
                "4 add 1 2 3",
                "5 sort bitvec 4",
                "6 add 5 2 3",
                "7 sort bitvec 1",
                "8 neq 7 4 6",
                "9 bad 8"));
    }

    @Test
    @DisplayName("结果长度为 (n1-1) + (n2-1-k) + 3")
    void testLength() {
        List<Instruction> other = flat(
                "10 sort bitvec 4",
                "11 sort bitvec 1",
                "20 input 10 a",
                "21 input 10 b",
                "30 sub 10 20 21",
                "31 add 10 30 21",
                "32 slt 11 20 21",
                "33 ite 10 32 31 20",
                "40 output 33");
        int n1 = ADDER.size();
        int n2 = other.size();
        int k = 2;

        List<Instruction> miter = MiterBuilder.merge(ADDER, other);

        assertThat(miter).hasSize((n1 - 1) + (n2 - 1 - k) + 3);
        assertThat(miter.get(miter.size() - 1).getOpcode()).isEqualTo(Opcode.BAD);
        assertThat(miter).noneMatch(inst -> inst.getOpcode() == Opcode.OUTPUT);
        // 合并结果中的 lid 互不重复，且可重新解析
        assertThat(flat(Btor2Printer.print(miter).split("\n"))).hasSameSizeAs(miter);
    }

    @Test
    @DisplayName("不修改参数")
    void testInputsUntouched() {
        List<Instruction> other = flat(ADDER_TEXT);
        MiterBuilder.merge(ADDER, other);
        assertThat(ADDER).hasSize(5);
        assertThat(Btor2Printer.print(other)).isEqualTo(text(ADDER_TEXT));
    }

    @Test
    @DisplayName("输入名字不匹配")
    void testNameMismatch() {
        List<Instruction> other = flat(
                "1 sort bitvec 4", "2 input 1 a", "3 input 1 c", "4 add 1 2 3", "5 output 4");
        assertThatThrownBy(() -> MiterBuilder.merge(ADDER, other))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("'c'");
    }

    @Test
    @DisplayName("输入宽度不匹配")
    void testSortMismatch() {
        List<Instruction> other = flat(
                "1 sort bitvec 4", "2 sort bitvec 8", "3 input 1 a", "4 input 2 b",
                "5 uext 2 3 4", "6 add 2 5 4", "7 output 6");
        assertThatThrownBy(() -> MiterBuilder.merge(ADDER, other)).isInstanceOf(StructuralException.class);
    }

    @Test
    @DisplayName("第一个程序有多余输入")
    void testUnmatchedInput() {
        List<Instruction> other = flat("1 sort bitvec 4", "2 input 1 a", "3 output 2");
        assertThatThrownBy(() -> MiterBuilder.merge(ADDER, other))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("[b]");
    }

    @Test
    @DisplayName("最后一条必须是 output")
    void testMissingOutput() {
        List<Instruction> other = flat("1 sort bitvec 4", "2 input 1 a", "3 input 1 b", "4 add 1 2 3");
        assertThatThrownBy(() -> MiterBuilder.merge(ADDER, other))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("second");
    }

    private static final String[] ADDER_TEXT = {
            "1 sort bitvec 4",
            "2 input 1 a",
            "3 input 1 b",
            "4 add 1 2 3",
            "5 output 4"
    };
}
