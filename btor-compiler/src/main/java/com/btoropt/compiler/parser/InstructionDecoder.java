package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.MalformedInstructionException;
import com.btoropt.compiler.error.UnresolvedReferenceException;
import com.btoropt.compiler.error.UnsupportedOpcodeException;
import com.btoropt.compiler.model.*;
import com.btoropt.compiler.model.Module;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 把一行 token 解码为指令，两种解析策略共用。
 * <p>
 * 解码只校验操作码和字段数量，不查找操作数：操作数以 lid 形式保存，
 * 由 {@link OperandResolver} 在查找表上统一解析。唯一的例外是 inst / ref，
 * 它们按名字引用其他模块，在解码时通过 {@link ModuleScope} 立即检查。
 */
public class InstructionDecoder {

    private final ModuleScope scope;
    private final Set<Opcode> allowedCustom;

    /**
     * 平坦 BTOR2 解码器：不接受任何自定义指令。
     */
    public InstructionDecoder() {
        this(ModuleScope.EMPTY, Collections.<Opcode>emptySet());
    }

    public InstructionDecoder(ModuleScope scope, Set<Opcode> allowedCustom) {
        this.scope = scope;
        this.allowedCustom = allowedCustom.isEmpty()
                ? Collections.<Opcode>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedCustom));
    }

    public Instruction decode(SourceLine line) {
        if (line.tokenCount() < 2) {
            throw new MalformedInstructionException("Instruction must start with <lid> <opcode>",
                    line.getNumber(), line.getText());
        }
        int lid = integer(line, 0, "line id");
        if (lid <= 0) {
            throw new MalformedInstructionException("Line id must be positive",
                    line.getNumber(), line.getText());
        }

        String tag = line.token(1);
        Opcode opcode = Opcode.fromToken(tag);
        if (opcode == null || (!opcode.isStandard() && !allowedCustom.contains(opcode))) {
            throw new UnsupportedOpcodeException(tag, line.getNumber(), line.getText());
        }
        if (line.tokenCount() < opcode.getMinTokens()) {
            throw new MalformedInstructionException(tag + " instruction needs at least "
                    + opcode.getMinTokens() + " fields, found " + line.tokenCount(),
                    line.getNumber(), line.getText());
        }

        switch (opcode.getFamily()) {
            case SORT: {
                SortKind kind = SortKind.fromKeyword(line.token(2));
                if (kind == null) {
                    throw new MalformedInstructionException("sort must be of type bitvector or array, found "
                            + line.token(2), line.getNumber(), line.getText());
                }
                return new Sort(lid, kind, line.token(2), integer(line, 3, "width"));
            }
            case DECLARATION:
                return new Declaration(lid, opcode, integer(line, 2, "sort"),
                        optionalName(line, 3, opcode, lid));
            case PROPERTY:
                return new Property(lid, opcode, integer(line, 2, "operand"),
                        line.tokenCount() > 3 ? line.token(3) : null);
            case SORT_CONSTANT:
                return new Instruction(lid, opcode, integer(line, 2, "sort"));
            case LITERAL:
                try {
                    return Literal.parse(lid, opcode, integer(line, 2, "sort"), line.token(3));
                } catch (NumberFormatException e) {
                    throw new MalformedInstructionException("Invalid base-" + opcode.getRadix()
                            + " constant " + line.token(3), line.getNumber(), line.getText());
                }
            case STATE_UPDATE:
                return new Instruction(lid, opcode, integer(line, 2, "sort"),
                        integer(line, 3, "state"), integer(line, 4, "value"));
            case SLICE: {
                int high = integer(line, 4, "highbit");
                int low = integer(line, 5, "lowbit");
                if (high < low || low < 0) {
                    throw new MalformedInstructionException("Invalid slice bounds " + high + ":" + low,
                            line.getNumber(), line.getText());
                }
                return new Slice(lid, integer(line, 2, "sort"), integer(line, 3, "operand"), high, low);
            }
            case TERNARY:
                return new Instruction(lid, opcode, integer(line, 2, "sort"), integer(line, 3, "condition"),
                        integer(line, 4, "then"), integer(line, 5, "else"));
            case BINARY:
                return new Instruction(lid, opcode, integer(line, 2, "sort"),
                        integer(line, 3, "operand"), integer(line, 4, "operand"));
            case UNARY:
                return new Instruction(lid, opcode, integer(line, 2, "sort"), integer(line, 3, "operand"));
            case EXTENSION:
                return new Extension(lid, opcode, integer(line, 2, "sort"), integer(line, 3, "operand"),
                        integer(line, 4, "width"), optionalName(line, 5, opcode, lid));
            case INSTANCE:
                return new Instance(lid, requireModule(line, line.token(2)).getName());
            case REFERENCE: {
                Module module = requireModule(line, line.token(2));
                int targetLid = integer(line, 3, "target");
                Instruction target = module.find(targetLid);
                if (target == null) {
                    throw new UnresolvedReferenceException("Module " + module.getName()
                            + " has no instruction with id " + targetLid, targetLid,
                            line.getNumber(), line.getText());
                }
                return new Ref(lid, module.getName(), target);
            }
            case BINDING:
                return new Instruction(lid, opcode, integer(line, 2, "instance"),
                        integer(line, 3, "ref"), integer(line, 4, "alias"));
            case CONDITION:
                return new Instruction(lid, opcode, integer(line, 2, "condition"));
            default:
                throw new UnsupportedOpcodeException(tag, line.getNumber(), line.getText());
        }
    }

    private Module requireModule(SourceLine line, String name) {
        Module module = scope.findModule(name);
        if (module == null) {
            throw new UnresolvedReferenceException("Named module " + name + " is undefined", -1,
                    line.getNumber(), line.getText());
        }
        return module;
    }

    /** 未命名的 input / state / uext / sext 以 {@code <opcode>_<lid>} 命名 */
    private static String optionalName(SourceLine line, int index, Opcode opcode, int lid) {
        return line.tokenCount() > index ? line.token(index) : opcode.getToken() + "_" + lid;
    }

    private static int integer(SourceLine line, int index, String what) {
        try {
            return Integer.parseInt(line.token(index));
        } catch (NumberFormatException e) {
            throw new MalformedInstructionException("Expected integer " + what + ", found '"
                    + line.token(index) + "'", line.getNumber(), line.getText());
        }
    }
}
