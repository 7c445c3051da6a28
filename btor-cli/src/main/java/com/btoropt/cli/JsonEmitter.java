package com.btoropt.cli;

import com.btoropt.compiler.model.*;
import com.btoropt.compiler.model.Module;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 指令序列与程序的 JSON 表示（Gson）。
 * <p>
 * 每条指令是一个对象：{@code lid}、{@code op}、{@code operands}，再加上操作码特有的字段。
 */
public final class JsonEmitter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private JsonEmitter() {}

    public static String toJson(List<? extends Instruction> instructions) {
        return GSON.toJson(toArray(instructions));
    }

    public static String toJson(Program program) {
        JsonObject root = new JsonObject();
        JsonArray modules = new JsonArray();
        for (Module module : program.getModules()) {
            JsonObject m = new JsonObject();
            m.addProperty("name", module.getName());
            m.add("body", toArray(module.getBody()));
            modules.add(m);
        }
        JsonArray contracts = new JsonArray();
        for (Contract contract : program.getContracts()) {
            JsonObject c = new JsonObject();
            c.addProperty("name", contract.getName());
            c.add("body", toArray(contract.getBody()));
            contracts.add(c);
        }
        root.add("modules", modules);
        root.add("contracts", contracts);
        return GSON.toJson(root);
    }

    static JsonArray toArray(List<? extends Instruction> instructions) {
        JsonArray array = new JsonArray();
        for (Instruction inst : instructions) {
            array.add(toObject(inst));
        }
        return array;
    }

    static JsonObject toObject(Instruction inst) {
        JsonObject obj = new JsonObject();
        obj.addProperty("lid", inst.getLid());
        obj.addProperty("op", inst.getOpcode().getToken());
        JsonArray operands = new JsonArray();
        for (int operand : inst.getOperands()) {
            operands.add(operand);
        }
        obj.add("operands", operands);

        if (inst instanceof Sort) {
            Sort sort = (Sort) inst;
            obj.addProperty("kind", sort.getKind().name().toLowerCase());
            obj.addProperty("width", sort.getWidth());
        } else if (inst instanceof Declaration) {
            obj.addProperty("name", ((Declaration) inst).getName());
        } else if (inst instanceof Property) {
            String name = ((Property) inst).getName();
            if (name != null) obj.addProperty("name", name);
        } else if (inst instanceof Literal) {
            // 十进制字符串，避免超宽常量丢失精度
            obj.addProperty("value", ((Literal) inst).getValue().toString());
        } else if (inst instanceof Slice) {
            obj.addProperty("high", ((Slice) inst).getHighBit());
            obj.addProperty("low", ((Slice) inst).getLowBit());
        } else if (inst instanceof Extension) {
            Extension ext = (Extension) inst;
            obj.addProperty("width", ext.getWidth());
            obj.addProperty("name", ext.getName());
        } else if (inst instanceof Instance) {
            obj.addProperty("module", ((Instance) inst).getModuleName());
        } else if (inst instanceof Ref) {
            obj.addProperty("module", ((Ref) inst).getModuleName());
            obj.addProperty("target", ((Ref) inst).getTargetLid());
        }
        return obj;
    }
}
