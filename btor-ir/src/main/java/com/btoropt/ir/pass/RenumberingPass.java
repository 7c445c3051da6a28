package com.btoropt.ir.pass;

import com.btoropt.compiler.model.Contract;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Module;
import com.btoropt.compiler.model.Opcode;
import com.btoropt.compiler.model.Program;
import com.btoropt.compiler.model.Ref;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 会重新编号 lid 的 pass 的基类。
 * <p>
 * 平坦序列上只需 {@link #renumber(List)}；模块化程序上，一个模块被重新编号后，
 * 其他模块和契约中指向它的 ref 也要跟着重连，因此先并行变换各模块，再统一修正 ref。
 */
public abstract class RenumberingPass implements Pass {

    /**
     * 一次重新编号的结果：新序列加上旧 lid → 新 lid 映射（只含原有指令）。
     */
    protected static final class Result {
        final List<Instruction> instructions;
        final LidRemap remap;

        public Result(List<Instruction> instructions, LidRemap remap) {
            this.instructions = instructions;
            this.remap = remap;
        }
    }

    protected abstract Result renumber(List<Instruction> instructions);

    @Override
    public List<Instruction> run(List<Instruction> instructions) {
        return renumber(instructions).instructions;
    }

    @Override
    public Program runOnProgram(Program program, Executor executor) {
        List<CompletableFuture<Result>> futures = new ArrayList<>();
        for (Module module : program.getModules()) {
            futures.add(CompletableFuture.supplyAsync(() -> renumber(module.getBody()), executor));
        }
        List<Result> results = ModuleFanOut.gather(futures);

        Map<String, Module> renumbered = new HashMap<>();
        Map<String, LidRemap> remaps = new HashMap<>();
        for (int i = 0; i < results.size(); i++) {
            String name = program.getModules().get(i).getName();
            renumbered.put(name, new Module(name, results.get(i).instructions));
            remaps.put(name, results.get(i).remap);
        }

        List<Module> modules = new ArrayList<>();
        for (Module module : program.getModules()) {
            Module m = renumbered.get(module.getName());
            modules.add(m.withBody(retarget(m.getBody(), renumbered, remaps)));
        }
        List<Contract> contracts = new ArrayList<>();
        for (Contract contract : program.getContracts()) {
            contracts.add(new Contract(contract.getName(), retarget(contract.getBody(), renumbered, remaps)));
        }
        return new Program(modules, contracts);
    }

    /** ref 的目标改为目标模块重新编号后的对应指令 */
    private static List<Instruction> retarget(List<Instruction> body, Map<String, Module> renumbered,
                                              Map<String, LidRemap> remaps) {
        List<Instruction> result = new ArrayList<>(body.size());
        for (Instruction inst : body) {
            if (inst.getOpcode() == Opcode.REF) {
                Ref ref = (Ref) inst;
                Module target = renumbered.get(ref.getModuleName());
                int newTarget = remaps.get(ref.getModuleName()).apply(ref.getTargetLid());
                result.add(new Ref(ref.getLid(), ref.getModuleName(), target.find(newTarget)));
            } else {
                result.add(inst);
            }
        }
        return result;
    }
}
