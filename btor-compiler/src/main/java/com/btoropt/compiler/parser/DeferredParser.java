package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.InstructionTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 两阶段（延迟）解析器。
 * <ol>
 *   <li>逐行独立解码，操作数只记录 lid（并行）</li>
 *   <li>由完整序列建立 lid → 指令查找表（屏障：表建好后不再修改）</li>
 *   <li>在完整的表上解析每条指令的操作数（并行）</li>
 * </ol>
 * 因此源码中允许前向引用。输出保持文件顺序。
 */
public class DeferredParser implements Btor2Parser {

    private static final Logger LOG = Logger.getLogger(DeferredParser.class.getName());

    private final InstructionDecoder decoder;

    public DeferredParser(InstructionDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public List<Instruction> parseLines(List<SourceLine> lines) {
        List<SourceLine> code = new ArrayList<>();
        for (SourceLine line : lines) {
            if (!line.isBlankOrComment()) code.add(line);
        }

        // 1. 解码
        List<Instruction> decoded = code.parallelStream()
                .map(decoder::decode)
                .collect(Collectors.toList());

        // 2. 查找表
        InstructionTable table = buildTable(decoded, code);

        // 3. 解析操作数
        IntStream.range(0, decoded.size()).parallel()
                .forEach(i -> OperandResolver.resolve(decoded.get(i), table, code.get(i)));

        LOG.fine(() -> "Resolved " + decoded.size() + " instructions in two phases");
        return decoded;
    }

    private static InstructionTable buildTable(List<Instruction> decoded, List<SourceLine> code) {
        Map<Integer, Integer> seen = new HashMap<>();
        for (int i = 0; i < decoded.size(); i++) {
            Integer previous = seen.putIfAbsent(decoded.get(i).getLid(), i);
            if (previous != null) {
                SourceLine line = code.get(i);
                throw new StructuralException("Duplicate line id " + decoded.get(i).getLid(),
                        line.getNumber(), line.getText());
            }
        }
        return InstructionTable.of(decoded);
    }
}
