package com.btoropt.compiler.parser;

import com.btoropt.compiler.model.Instruction;

import java.util.List;

/**
 * 平坦 BTOR2 解析器：行序列 → 指令序列。
 */
public interface Btor2Parser {

    /**
     * 解析按行拆分的源码。空行与 {@code ;} 注释行被忽略。
     */
    default List<Instruction> parse(List<String> lines) {
        return parseLines(SourceLine.number(lines));
    }

    List<Instruction> parseLines(List<SourceLine> lines);

    /**
     * 按策略创建平坦 BTOR2 解析器。
     */
    static Btor2Parser create(ParseStrategy strategy) {
        switch (strategy) {
            case DEFERRED: return new DeferredParser(new InstructionDecoder());
            case EAGER:
            default:       return new EagerParser(new InstructionDecoder());
        }
    }
}
