package com.btoropt.ir.pass.transform;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.*;
import com.btoropt.compiler.model.Module;
import com.btoropt.ir.pass.Pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.IntUnaryOperator;
import java.util.logging.Logger;

/**
 * 模块化脱糖：按 Hoare 三元组消去全部实例与契约。
 * <ul>
 *   <li>实例化无契约的模块：内联模块体，被 set 绑定的 input 的全部使用改为绑定值</li>
 *   <li>实例化有契约的模块：不内联。断言前置条件（作用在 set 传入的值上），
 *       假设后置条件；被引用的模块内部值变为自由 input</li>
 *   <li>有契约的模块本身：入口假设前置条件，在输出之前断言后置条件</li>
 * </ul>
 * 断言编码为 {@code not cond; bad}，假设编码为 {@code constraint cond}。
 * 执行后程序中不再有契约，也不再有 inst / ref / set / prec / post。
 * <p>
 * 模块只能实例化在它之前定义的模块，因此按定义顺序逐个处理，被实例化的模块总是已经脱糖。
 */
public class ApplyContracts implements Pass {

    private static final Logger LOG = Logger.getLogger(ApplyContracts.class.getName());

    @Override
    public String getId() {
        return "apply-contracts";
    }

    /**
     * 平坦序列没有模块和契约，原样返回。
     */
    @Override
    public List<Instruction> run(List<Instruction> instructions) {
        return instructions;
    }

    @Override
    public Program runOnProgram(Program program, Executor executor) {
        Map<String, Module> desugared = new HashMap<>();
        List<Module> modules = new ArrayList<>();
        for (Module module : program.getModules()) {
            Module result = desugar(module, program, desugared);
            desugared.put(module.getName(), result);
            modules.add(result);
        }
        LOG.fine(() -> "Desugared " + modules.size() + " modules, dropped "
                + program.getContracts().size() + " contracts");
        return new Program(modules, Collections.<Contract>emptyList());
    }

    private Module desugar(Module module, Program program, Map<String, Module> desugared) {
        List<Instruction> body = module.getBody();
        InstructionTable table = module.table();
        Host host = new Host(module, table.maxLid() + 1);

        // 1. 每个实例在其最后一个 set（或实例本身）之后展开
        Map<String, Instance> instanceByModule = new HashMap<>();
        List<Instance> instances = new ArrayList<>();
        for (Instruction inst : body) {
            if (inst.getOpcode() != Opcode.INST) continue;
            Instance instance = (Instance) inst;
            if (instanceByModule.put(instance.getModuleName(), instance) != null) {
                throw new StructuralException("Module " + module.getName() + " instantiates "
                        + instance.getModuleName() + " more than once");
            }
            instances.add(instance);
        }
        Map<Integer, Integer> anchors = new HashMap<>();
        for (Instance instance : instances) {
            anchors.put(instance.getLid(), anchorOf(instance, body));
        }
        instances.sort(Comparator.comparingInt(i -> anchors.get(i.getLid())));

        Map<Integer, List<Instruction>> expansions = new HashMap<>();
        for (Instance instance : instances) {
            int anchor = anchors.get(instance.getLid());
            String callee = instance.getModuleName();
            Module calleeBody = desugared.get(callee);
            Map<Integer, Integer> bindings = bindingsOf(instance, body, table);
            Expansion expansion = new Expansion(host, anchor);

            IntUnaryOperator calleeValue;
            Contract contract = program.findContract(callee);
            if (contract == null) {
                calleeValue = inline(calleeBody, bindings, expansion);
            } else {
                calleeValue = abstractInstance(calleeBody, contract, bindings, expansion);
            }

            // 宿主中指向被实例化模块的 ref 改为展开后的对应值
            for (Instruction inst : body) {
                if (inst.getOpcode() == Opcode.REF && ((Ref) inst).getModuleName().equals(callee)) {
                    host.substitute(inst.getLid(), calleeValue.applyAsInt(((Ref) inst).getTargetLid()));
                }
            }
            expansions.put(anchor, expansion.instructions);
        }

        // 2. 组装：丢弃 inst / set / ref，在锚点之后插入展开结果
        List<Instruction> assembled = new ArrayList<>();
        for (int pos = 0; pos < body.size(); pos++) {
            Instruction inst = body.get(pos);
            switch (inst.getOpcode()) {
                case INST:
                case SET:
                    break;
                case REF: {
                    Ref ref = (Ref) inst;
                    if (!instanceByModule.containsKey(ref.getModuleName())) {
                        throw new StructuralException("Module " + module.getName() + " refers to "
                                + ref.qualifiedName() + " without instantiating " + ref.getModuleName());
                    }
                    break;
                }
                default:
                    assembled.add(inst);
            }
            List<Instruction> expansion = expansions.get(pos);
            if (expansion != null) {
                assembled.addAll(expansion);
            }
        }

        // 3. 定义侧契约：入口假设前置条件，输出之前断言后置条件
        Contract own = program.findContract(module.getName());
        if (own != null) {
            assembled = wrapWithContract(module, own, assembled, host);
        }

        List<Instruction> result = new ArrayList<>(assembled.size());
        for (Instruction inst : assembled) {
            result.add(host.rewire(inst));
        }
        return new Module(module.getName(), result);
    }

    /**
     * 内联被实例化模块的（已脱糖的）模块体。
     *
     * @return 被实例化模块的 lid → 宿主 lid
     */
    private IntUnaryOperator inline(Module callee, Map<Integer, Integer> bindings, Expansion expansion) {
        Map<Integer, Integer> mapped = new HashMap<>();
        List<Instruction> copied = new ArrayList<>();

        for (Instruction inst : callee.getBody()) {
            switch (inst.getOpcode()) {
                case INPUT:
                    if (bindings.containsKey(inst.getLid())) {
                        mapped.put(inst.getLid(), bindings.get(inst.getLid()));
                    } else {
                        mapped.put(inst.getLid(), expansion.host.freshLid());
                        copied.add(inst);
                    }
                    break;
                case SORT:
                    mapped.put(inst.getLid(), expansion.sort((Sort) inst));
                    break;
                case OUTPUT:
                    break;
                default:
                    mapped.put(inst.getLid(), expansion.host.freshLid());
                    copied.add(inst);
            }
        }
        // 输出不内联：引用输出等同于引用它的值
        for (Instruction inst : callee.getBody()) {
            if (inst.getOpcode() == Opcode.OUTPUT) {
                mapped.put(inst.getLid(), mapped.get(((Property) inst).value()));
            }
        }

        for (Instruction inst : copied) {
            int[] operands = inst.getOperands();
            for (int i = 0; i < operands.length; i++) {
                operands[i] = mapped.get(operands[i]);
            }
            Instruction copy = inst.withLid(mapped.get(inst.getLid())).withOperands(operands);
            if (copy.getOpcode() == Opcode.INPUT) {
                Declaration input = (Declaration) copy;
                copy = input.withName(callee.getName() + "." + input.getName());
            }
            expansion.emit(copy);
        }

        return lid -> {
            Integer hostLid = mapped.get(lid);
            if (hostLid == null) {
                throw new StructuralException("Reference " + callee.getName() + ":" + lid
                        + " has no counterpart after inlining");
            }
            return hostLid;
        };
    }

    /**
     * 有契约的实例：模块体不内联，被引用的内部值成为自由 input，
     * 并在调用点断言前置条件、假设后置条件。
     *
     * @return 被实例化模块的 lid → 宿主 lid（按需创建自由 input）
     */
    private IntUnaryOperator abstractInstance(Module callee, Contract contract,
                                              Map<Integer, Integer> bindings, Expansion expansion) {
        Map<Integer, Integer> havoc = new HashMap<>();
        InstructionTable calleeTable = callee.table();

        IntUnaryOperator calleeValue = new IntUnaryOperator() {
            @Override
            public int applyAsInt(int lid) {
                // 引用输出等同于引用它的值
                Instruction target = calleeTable.get(lid);
                if (target != null && target.getOpcode() == Opcode.OUTPUT) {
                    target = calleeTable.get(((Property) target).value());
                }
                int valueLid = target == null ? lid : target.getLid();

                Integer bound = bindings.get(valueLid);
                if (bound != null) return bound;
                Integer existing = havoc.get(valueLid);
                if (existing != null) return existing;

                Sort sort = target == null ? null : calleeTable.sortOf(target);
                if (sort == null) {
                    throw new StructuralException("Reference " + callee.getName() + ":" + lid
                            + " does not name a value of the abstracted module");
                }
                String name = target.getOpcode() == Opcode.INPUT
                        ? callee.getName() + "." + ((Declaration) target).getName()
                        : callee.getName() + "." + valueLid;
                int fresh = expansion.host.freshLid();
                expansion.emit(Declaration.input(fresh, expansion.sort(sort), name));
                havoc.put(valueLid, fresh);
                return fresh;
            }
        };

        instantiateContract(contract, callee.getName(), calleeValue, Polarity.ASSERT, Polarity.ASSUME, expansion);
        return calleeValue;
    }

    /**
     * 定义侧：契约体追加在模块体之后，模块的 output 移到最后。
     */
    private List<Instruction> wrapWithContract(Module module, Contract contract, List<Instruction> assembled,
                                               Host host) {
        InstructionTable table = module.table();
        Expansion expansion = new Expansion(host, Integer.MAX_VALUE);
        IntUnaryOperator ownValue = lid -> {
            Instruction target = table.get(lid);
            if (target != null && target.getOpcode() == Opcode.OUTPUT) {
                return ((Property) target).value();
            }
            return lid;
        };
        instantiateContract(contract, module.getName(), ownValue, Polarity.ASSUME, Polarity.ASSERT, expansion);

        List<Instruction> result = new ArrayList<>();
        List<Instruction> outputs = new ArrayList<>();
        for (Instruction inst : assembled) {
            if (inst.getOpcode() == Opcode.OUTPUT) outputs.add(inst);
            else result.add(inst);
        }
        result.addAll(expansion.instructions);
        result.addAll(outputs);
        return result;
    }

    /**
     * 把契约体复制到宿主中。契约里的 ref 经 {@code refValue} 映射到宿主 lid。
     * <p>
     * 延迟解析的契约体可以前向引用，因此先为全部指令分配宿主 lid，再按依赖顺序复制，
     * 最后追加前置和后置条件。
     */
    private void instantiateContract(Contract contract, String moduleName, IntUnaryOperator refValue,
                                     Polarity preconditions, Polarity postconditions, Expansion expansion) {
        Map<Integer, Integer> mapped = new HashMap<>();
        Map<Integer, Instruction> values = new LinkedHashMap<>();
        List<Instruction> conditions = new ArrayList<>();

        // 1. 分配 lid
        for (Instruction inst : contract.getBody()) {
            switch (inst.getOpcode()) {
                case REF: {
                    Ref ref = (Ref) inst;
                    if (!ref.getModuleName().equals(moduleName)) {
                        throw new StructuralException("Contract " + contract.getName() + " refers to "
                                + ref.qualifiedName() + " outside of its module");
                    }
                    mapped.put(ref.getLid(), refValue.applyAsInt(ref.getTargetLid()));
                    break;
                }
                case SORT:
                    mapped.put(inst.getLid(), expansion.sort((Sort) inst));
                    break;
                case PREC:
                case POST:
                    conditions.add(inst);
                    break;
                default:
                    mapped.put(inst.getLid(), expansion.host.freshLid());
                    values.put(inst.getLid(), inst);
            }
        }

        // 2. 先定义后使用
        Set<Integer> emitted = new HashSet<>();
        for (Integer lid : values.keySet()) {
            emitOrdered(contract, lid, values, mapped, emitted, new HashSet<Integer>(), expansion);
        }

        // 3. 条件
        for (Instruction cond : conditions) {
            Polarity polarity = cond.getOpcode() == Opcode.PREC ? preconditions : postconditions;
            expansion.condition(mappedOperand(contract, mapped, cond.operand(0)), polarity);
        }
    }

    private static void emitOrdered(Contract contract, int lid, Map<Integer, Instruction> values,
                                    Map<Integer, Integer> mapped, Set<Integer> emitted, Set<Integer> visiting,
                                    Expansion expansion) {
        if (emitted.contains(lid)) return;
        if (!visiting.add(lid)) {
            throw new StructuralException("Contract " + contract.getName()
                    + " has a cyclic definition involving line id " + lid);
        }
        Instruction inst = values.get(lid);
        int[] operands = inst.getOperands();
        for (int i = 0; i < operands.length; i++) {
            if (values.containsKey(operands[i])) {
                emitOrdered(contract, operands[i], values, mapped, emitted, visiting, expansion);
            }
            operands[i] = mappedOperand(contract, mapped, operands[i]);
        }
        expansion.emit(inst.withLid(mapped.get(lid)).withOperands(operands));
        visiting.remove(lid);
        emitted.add(lid);
    }

    private static int mappedOperand(Contract contract, Map<Integer, Integer> mapped, int lid) {
        Integer hostLid = mapped.get(lid);
        if (hostLid == null) {
            throw new StructuralException("Contract " + contract.getName() + " uses undeclared line id " + lid);
        }
        return hostLid;
    }

    /** 实例的展开位置：实例及其全部 set 中最靠后的一条 */
    private static int anchorOf(Instance instance, List<Instruction> body) {
        int anchor = -1;
        for (int pos = 0; pos < body.size(); pos++) {
            Instruction inst = body.get(pos);
            if (inst == instance || (inst.getOpcode() == Opcode.SET && inst.operand(0) == instance.getLid())) {
                anchor = pos;
            }
        }
        return anchor;
    }

    /** 被实例化模块的 input lid → 宿主中绑定的值 */
    private static Map<Integer, Integer> bindingsOf(Instance instance, List<Instruction> body,
                                                    InstructionTable table) {
        Map<Integer, Integer> bindings = new HashMap<>();
        for (Instruction inst : body) {
            if (inst.getOpcode() == Opcode.SET && inst.operand(0) == instance.getLid()) {
                Ref ref = (Ref) table.get(inst.operand(1));
                if (bindings.put(ref.getTargetLid(), inst.operand(2)) != null) {
                    throw new StructuralException("Input " + ref.qualifiedName() + " is set more than once");
                }
            }
        }
        return bindings;
    }

    private enum Polarity {
        /** constraint cond */
        ASSUME,
        /** not cond; bad */
        ASSERT
    }

    /**
     * 正在脱糖的宿主模块：新 lid 分配、可复用的 sort、ref 替换表。
     */
    private static final class Host {
        private final List<Sort> sorts = new ArrayList<>();
        private final Map<Sort, Integer> sortPositions = new HashMap<>();
        private final Map<Integer, Integer> substitution = new HashMap<>();
        private int nextLid;

        Host(Module module, int firstFreeLid) {
            this.nextLid = firstFreeLid;
            List<Instruction> body = module.getBody();
            for (int pos = 0; pos < body.size(); pos++) {
                if (body.get(pos).getOpcode() == Opcode.SORT) {
                    addSort((Sort) body.get(pos), pos);
                }
            }
        }

        int freshLid() {
            return nextLid++;
        }

        void addSort(Sort sort, int position) {
            sorts.add(sort);
            sortPositions.put(sort, position);
        }

        /** 位于 position 之前（含）且类型相同的 sort，没有则返回 null */
        Sort findSort(Sort like, int position) {
            for (Sort sort : sorts) {
                if (sort.sameType(like) && sortPositions.get(sort) <= position) return sort;
            }
            return null;
        }

        void substitute(int refLid, int value) {
            substitution.put(refLid, value);
        }

        /** ref 可能绑定到另一个 ref，沿替换链走到底 */
        int resolve(int lid) {
            int current = lid;
            int steps = 0;
            while (substitution.containsKey(current)) {
                current = substitution.get(current);
                if (++steps > substitution.size()) {
                    throw new StructuralException("Cyclic ref bindings involving line id " + lid);
                }
            }
            return current;
        }

        Instruction rewire(Instruction inst) {
            int[] operands = inst.getOperands();
            boolean changed = false;
            for (int i = 0; i < operands.length; i++) {
                int resolved = resolve(operands[i]);
                changed |= resolved != operands[i];
                operands[i] = resolved;
            }
            return changed ? inst.withOperands(operands) : inst;
        }
    }

    /**
     * 在宿主某个位置插入的一段新指令。
     */
    private static final class Expansion {
        final Host host;
        final int position;
        final List<Instruction> instructions = new ArrayList<>();
        private int boolSort = -1;

        Expansion(Host host, int position) {
            this.host = host;
            this.position = position;
        }

        void emit(Instruction inst) {
            instructions.add(inst);
        }

        /** 宿主中与给定 sort 同类型的 sort lid，必要时新建 */
        int sort(Sort like) {
            Sort existing = host.findSort(like, position);
            if (existing != null) return existing.getLid();
            Sort copy = (Sort) like.withLid(host.freshLid());
            host.addSort(copy, position);
            emit(copy);
            return copy.getLid();
        }

        void condition(int cond, Polarity polarity) {
            if (polarity == Polarity.ASSUME) {
                emit(Property.constraint(host.freshLid(), cond));
            } else {
                if (boolSort < 0) boolSort = sort(Sort.bitvector(0, 1));
                int negated = host.freshLid();
                emit(new Instruction(negated, Opcode.NOT, boolSort, cond));
                emit(Property.bad(host.freshLid(), negated));
            }
        }
    }
}
