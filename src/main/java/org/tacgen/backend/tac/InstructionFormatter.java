package org.tacgen.backend.tac;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an instruction listing as numbered text, JSON or YAML.
 * <p>
 * JSON and YAML carry one {@code {line, code}} entry per instruction, in order.
 */
public class InstructionFormatter {

    private InstructionFormatter() {
    }

    public static String format(List<Instruction> instructions, OutputFormat format) {
        switch (format) {
            case JSON:
                return toJson(instructions);
            case YAML:
                return toYaml(instructions);
            case TEXT:
            default:
                return toText(instructions);
        }
    }

    public static String toText(List<Instruction> instructions) {
        return instructions.stream()
                .map(Instruction::toString)
                .collect(Collectors.joining("\n"));
    }

    public static String toJson(List<Instruction> instructions) {
        return JSON.toJSONString(toMaps(instructions), JSONWriter.Feature.PrettyFormat);
    }

    public static String toYaml(List<Instruction> instructions) {
        DumpSettings dumpSettings = DumpSettings.builder()
                .setDefaultFlowStyle(FlowStyle.BLOCK)
                .setIndent(2)
                .build();
        return new Dump(dumpSettings).dumpToString(toMaps(instructions));
    }

    private static List<Map<String, Object>> toMaps(List<Instruction> instructions) {
        List<Map<String, Object>> steps = new ArrayList<>(instructions.size());
        for (Instruction instruction : instructions) {
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("line", instruction.sequenceNumber());
            step.put("code", instruction.text());
            steps.add(step);
        }
        return steps;
    }
}
