package com.btoropt.compiler.model;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.error.UnresolvedReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模块化程序：一组模块加一组契约。
 * <p>
 * 构造时立即检查：
 * <ul>
 *   <li>契约数不多于模块数</li>
 *   <li>每个模块至多关联一个契约</li>
 *   <li>每个契约恰好命名一个已存在的模块</li>
 * </ul>
 */
public class Program {

    private final List<Module> modules;
    private final List<Contract> contracts;

    public Program(List<Module> modules, List<Contract> contracts) {
        this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
        this.contracts = Collections.unmodifiableList(new ArrayList<>(contracts));

        if (contracts.size() > modules.size()) {
            throw new StructuralException("There should be at least as many modules as there are contracts ("
                    + modules.size() + " modules, " + contracts.size() + " contracts)");
        }
        for (Module m : modules) {
            int count = 0;
            for (Contract c : contracts) {
                if (c.getName().equals(m.getName())) count++;
            }
            if (count > 1) {
                throw new StructuralException("Module " + m.getName() + " has more than one contract");
            }
        }
        for (Contract c : contracts) {
            int count = 0;
            for (Module m : modules) {
                if (m.getName().equals(c.getName())) count++;
            }
            if (count != 1) {
                throw new StructuralException("Contract " + c.getName() + " references " + count
                        + " modules instead of 1");
            }
        }
    }

    public List<Module> getModules() { return modules; }
    public List<Contract> getContracts() { return contracts; }

    /**
     * 按名字取模块。
     *
     * @throws UnresolvedReferenceException 名字未定义
     */
    public Module getModule(String name) {
        for (Module m : modules) {
            if (m.getName().equals(name)) return m;
        }
        throw new UnresolvedReferenceException("Named module " + name + " is undefined", -1);
    }

    /** 取与模块同名的契约，不存在返回 null */
    public Contract findContract(String name) {
        for (Contract c : contracts) {
            if (c.getName().equals(name)) return c;
        }
        return null;
    }

    /** 同一组契约，替换模块列表 */
    public Program withModules(List<Module> newModules) {
        return new Program(newModules, contracts);
    }
}
