package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.InstructionTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序解析器。
 * <p>
 * 按文件顺序逐行构造指令，每个操作数立即在已构造的指令中查找；
 * 前向引用会以 {@code UnresolvedReferenceException} 失败。
 */
public class EagerParser implements Btor2Parser {

    private final InstructionDecoder decoder;

    public EagerParser(InstructionDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public List<Instruction> parseLines(List<SourceLine> lines) {
        InstructionTable table = new InstructionTable();
        List<Instruction> result = new ArrayList<>();
        for (SourceLine line : lines) {
            if (line.isBlankOrComment()) continue;
            Instruction inst = decoder.decode(line);
            OperandResolver.resolve(inst, table, line);
            if (table.contains(inst.getLid())) {
                throw new StructuralException("Duplicate line id " + inst.getLid(),
                        line.getNumber(), line.getText());
            }
            table.add(inst);
            result.add(inst);
        }
        return result;
    }
}
