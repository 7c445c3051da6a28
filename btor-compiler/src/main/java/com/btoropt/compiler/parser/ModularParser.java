package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.Contract;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Module;
import com.btoropt.compiler.model.Opcode;
import com.btoropt.compiler.model.Program;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 模块化 BTOR2 解析器。
 * <p>
 * 在标准语法之上增加块结构：
 * <pre>
 * module &lt;name&gt; {
 *   &lt;body-lines&gt;
 * }
 * contract &lt;name&gt; {
 *   &lt;body-lines&gt;
 * }
 * </pre>
 * 模块体额外接受 inst / ref / set，契约体额外接受 prec / post / ref。
 * 块按自上而下的顺序处理，只能引用之前已定义的模块。
 * 全部块扫描完成后才构造 {@link Program}，其不变式在构造时立即检查。
 */
public class ModularParser implements ModuleScope {

    private static final Logger LOG = Logger.getLogger(ModularParser.class.getName());

    private static final EnumSet<Opcode> MODULE_CUSTOM = EnumSet.of(Opcode.INST, Opcode.REF, Opcode.SET);
    private static final EnumSet<Opcode> CONTRACT_CUSTOM = EnumSet.of(Opcode.PREC, Opcode.POST, Opcode.REF);

    private final ParseStrategy strategy;
    private final Map<String, Module> modules = new LinkedHashMap<>();
    private final List<Contract> contracts = new ArrayList<>();

    public ModularParser() {
        this(ParseStrategy.EAGER);
    }

    /**
     * @param strategy 块体内部使用的解析策略
     */
    public ModularParser(ParseStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public Module findModule(String name) {
        return modules.get(name);
    }

    public Program parse(List<String> lines) {
        modules.clear();
        contracts.clear();

        List<SourceLine> source = SourceLine.number(lines);
        int i = 0;
        while (i < source.size()) {
            SourceLine line = source.get(i);
            if (line.isBlankOrComment()) {
                i++;
                continue;
            }
            String tag = line.token(0);
            switch (tag) {
                case "module": {
                    String name = header(line);
                    if (modules.containsKey(name)) {
                        throw new StructuralException("Module " + name + " is defined twice",
                                line.getNumber(), line.getText());
                    }
                    List<SourceLine> body = new ArrayList<>();
                    i = scanBody(source, i, body);
                    List<Instruction> insts = bodyParser(MODULE_CUSTOM).parseLines(body);
                    modules.put(name, new Module(name, insts));
                    break;
                }
                case "contract": {
                    String name = header(line);
                    if (!modules.containsKey(name)) {
                        throw new StructuralException("Contract name " + name + " is not a defined module",
                                line.getNumber(), line.getText());
                    }
                    List<SourceLine> body = new ArrayList<>();
                    i = scanBody(source, i, body);
                    List<Instruction> insts = bodyParser(CONTRACT_CUSTOM).parseLines(body);
                    try {
                        contracts.add(new Contract(name, insts));
                    } catch (StructuralException e) {
                        throw new StructuralException(e.getMessage(), line.getNumber(), line.getText(), e);
                    }
                    break;
                }
                default:
                    throw new StructuralException("Unsupported structure: " + tag + " is not module | contract",
                            line.getNumber(), line.getText());
            }
        }

        Program program = new Program(new ArrayList<>(modules.values()), contracts);
        LOG.fine(() -> "Parsed " + program.getModules().size() + " modules and "
                + program.getContracts().size() + " contracts");
        return program;
    }

    private Btor2Parser bodyParser(EnumSet<Opcode> custom) {
        InstructionDecoder decoder = new InstructionDecoder(this, custom);
        return strategy == ParseStrategy.DEFERRED ? new DeferredParser(decoder) : new EagerParser(decoder);
    }

    /** 校验块头（关键字、名字、左花括号）并返回名字 */
    private static String header(SourceLine line) {
        if (line.tokenCount() != 3 || !"{".equals(line.token(2))) {
            throw new StructuralException("Invalid body start: expected '" + line.token(0) + " <name> {'",
                    line.getNumber(), line.getText());
        }
        return line.token(1);
    }

    /**
     * 收集块体，直到遇到单独一行的右花括号。
     *
     * @return 块结束符之后的下一行下标
     */
    private static int scanBody(List<SourceLine> source, int start, List<SourceLine> body) {
        int i = start + 1;
        while (i < source.size()) {
            SourceLine line = source.get(i);
            if (line.getText().trim().equals("}")) {
                return i + 1;
            }
            if (!line.isBlankOrComment() && !isNumeric(line.token(0))) {
                throw new StructuralException("All body lines must be instructions, found: " + line.token(0),
                        line.getNumber(), line.getText());
            }
            body.add(line);
            i++;
        }
        SourceLine opening = source.get(start);
        throw new StructuralException("Missing '}' for block " + opening.token(1),
                opening.getNumber(), opening.getText());
    }

    private static boolean isNumeric(String token) {
        if (token.isEmpty()) return false;
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) return false;
        }
        return true;
    }
}
