package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.*;
import com.btoropt.compiler.model.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EagerParser 单元测试
 */
class EagerParserTest {

    private List<Instruction> parse(String... lines) {
        return Btor2Parser.create(ParseStrategy.EAGER).parse(Arrays.asList(lines));
    }

    // ============ 基本解析 ============

    @Nested
    @DisplayName("基本解析")
    class BasicTests {

        @Test
        @DisplayName("七条指令的小电路")
        void testBasicCircuit() {
            List<Instruction> prgm = parse(
                    "1 sort bitvector 1",
                    "2 input 1 a",
                    "3 const 1 1",
                    "4 or 1 2 3",
                    "5 eq 1 2 3",
                    "6 not 1 5",
                    "7 bad 6");
            assertEquals(7, prgm.size());
            assertEquals(Opcode.SORT, prgm.get(0).getOpcode());
            assertEquals(Opcode.INPUT, prgm.get(1).getOpcode());
            assertEquals("a", ((Declaration) prgm.get(1)).getName());
            assertEquals(BigInteger.ONE, ((Literal) prgm.get(2)).getValue());
            assertArrayEquals(new int[]{1, 2, 3}, prgm.get(3).getOperands());
        }

        @Test
        @DisplayName("带使能端的寄存器")
        void testRegisterWithEnable() {
            List<Instruction> prgm = Btor2Parser.create(ParseStrategy.EAGER)
                    .parse(TestSources.resource("reg_en.btor2"));
            assertEquals(22, prgm.size());
            assertEquals(Opcode.SORT, prgm.get(0).getOpcode());
            assertEquals(Opcode.INPUT, prgm.get(1).getOpcode());
            assertEquals(Opcode.OUTPUT, prgm.get(21).getOpcode());
            assertEquals("q_out", ((Property) prgm.get(21)).getName());
        }

        @Test
        @DisplayName("注释与空行被忽略")
        void testCommentsAndBlankLines() {
            List<Instruction> prgm = parse("; header", "", "1 sort bitvec 4", "   ", "; trailing");
            assertEquals(1, prgm.size());
        }

        @Test
        @DisplayName("未命名的 input 与 state 获得默认名字")
        void testDefaultNames() {
            List<Instruction> prgm = parse("1 sort bitvec 4", "2 input 1", "3 state 1");
            assertEquals("input_2", ((Declaration) prgm.get(1)).getName());
            assertEquals("state_3", ((Declaration) prgm.get(2)).getName());
        }

        @Test
        @DisplayName("各进制常量")
        void testLiteralRadix() {
            List<Instruction> prgm = parse(
                    "1 sort bitvec 8",
                    "2 constd 1 -3",
                    "3 consth 1 ff",
                    "4 const 1 1010");
            assertEquals(BigInteger.valueOf(-3), ((Literal) prgm.get(1)).getValue());
            assertEquals(BigInteger.valueOf(255), ((Literal) prgm.get(2)).getValue());
            assertEquals(BigInteger.valueOf(10), ((Literal) prgm.get(3)).getValue());
        }

        @Test
        @DisplayName("slice 宽度由高低位得出")
        void testSliceWidth() {
            List<Instruction> prgm = parse("1 sort bitvec 8", "2 sort bitvec 3", "3 input 1 x", "4 slice 2 3 5 3");
            Slice slice = (Slice) prgm.get(3);
            assertEquals(5, slice.getHighBit());
            assertEquals(3, slice.getLowBit());
            assertEquals(3, slice.getWidth());
        }
    }

    // ============ 往返 ============

    @Nested
    @DisplayName("序列化往返")
    class RoundTripTests {

        @Test
        @DisplayName("打印结果与源码逐行一致")
        void testRoundTrip() {
            List<String> source = TestSources.resource("reg_en.btor2");
            List<Instruction> prgm = Btor2Parser.create(ParseStrategy.EAGER).parse(source);
            assertEquals(String.join("\n", TestSources.code(source)), Btor2Printer.print(prgm));
        }

        @Test
        @DisplayName("保留 sort 关键字与常量原文")
        void testKeepsOriginalSpelling() {
            List<Instruction> prgm = parse("1 sort bitvector 8", "2 consth 1 0F");
            assertEquals("1 sort bitvector 8\n2 consth 1 0F", Btor2Printer.print(prgm));
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("未知操作码")
        void testUnknownOpcode() {
            UnsupportedOpcodeException e = assertThrows(UnsupportedOpcodeException.class,
                    () -> parse("1 sort bitvec 1", "2 frobnicate 1"));
            assertEquals(2, e.getLineNumber());
            assertTrue(e.getMessage().contains("Unsupported operation type: frobnicate"));
        }

        @Test
        @DisplayName("平坦文件不接受自定义指令")
        void testCustomOpcodeRejected() {
            assertThrows(UnsupportedOpcodeException.class, () -> parse("1 sort bitvec 1", "2 prec 1"));
        }

        @Test
        @DisplayName("字段不足")
        void testTooFewFields() {
            MalformedInstructionException e = assertThrows(MalformedInstructionException.class,
                    () -> parse("1 sort bitvec 1", "2 add 1 1"));
            assertEquals("2 add 1 1", e.getLine());
        }

        @Test
        @DisplayName("非法常量")
        void testBadLiteral() {
            assertThrows(MalformedInstructionException.class, () -> parse("1 sort bitvec 4", "2 const 1 102"));
        }

        @Test
        @DisplayName("非法 sort 关键字")
        void testBadSortKind() {
            assertThrows(MalformedInstructionException.class, () -> parse("1 sort matrix 4"));
        }

        @Test
        @DisplayName("前向引用在即时解析中失败")
        void testForwardReference() {
            UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                    () -> parse("1 sort bitvec 1", "2 not 1 3", "3 input 1 x"));
            assertEquals(3, e.getReferencedLid());
            assertTrue(e.getMessage().contains("Undeclared instruction used with id: 3"));
        }

        @Test
        @DisplayName("操作数种类不符")
        void testWrongOperandKind() {
            // input 的 sort 位置引用了一个 input
            assertThrows(UnresolvedReferenceException.class,
                    () -> parse("1 sort bitvec 1", "2 input 1 x", "3 input 2 y"));
        }

        @Test
        @DisplayName("重复的 lid")
        void testDuplicateLid() {
            StructuralException e = assertThrows(StructuralException.class,
                    () -> parse("1 sort bitvec 1", "1 sort bitvec 2"));
            assertEquals(2, e.getLineNumber());
        }
    }
}
