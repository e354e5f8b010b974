package com.randodo.pattern.json;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.randodo.pattern.parser.Generator;
import com.randodo.pattern.parser.Generator.Alternation;
import com.randodo.pattern.parser.Generator.CharacterClass;
import com.randodo.pattern.parser.Generator.Constant;
import com.randodo.pattern.parser.Generator.Node;
import com.randodo.pattern.parser.Generator.Repetition;
import com.randodo.pattern.parser.Generator.Series;
import com.randodo.pattern.parser.Generator.VariableReference;

/**
 * JSON views of compiled trees and generated samples.
 *
 * Tree shape:
 *   {"type":"alternation","branches":[{"type":"series","children":[{"type":"constant","text":"ab"}]}]}
 */
public final class GeneratorJson {

    private static final ObjectMapper om = new ObjectMapper();

    private GeneratorJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    public static ObjectNode toJson(Node root) {
        return root.accept(new TreeWriter());
    }

    /** {"name": name, "samples": [...]} */
    public static ObjectNode samplesToJson(String name, List<String> samples) {
        ObjectNode out = om.createObjectNode();
        out.put("name", name);
        ArrayNode arr = out.putArray("samples");
        for (String s : samples) arr.add(s);
        return out;
    }

    public static String pretty(ObjectNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tree node", e);
        }
    }

    private static final class TreeWriter implements Generator.Visitor<ObjectNode> {

        private ObjectNode typed(String type) {
            ObjectNode n = om.createObjectNode();
            n.put("type", type);
            return n;
        }

        @Override
        public ObjectNode visitConstant(Constant node) {
            ObjectNode n = typed("constant");
            n.put("text", node.text);
            return n;
        }

        @Override
        public ObjectNode visitCharacterClass(CharacterClass node) {
            ObjectNode n = typed("characterClass");
            n.put("chars", node.chars);
            return n;
        }

        @Override
        public ObjectNode visitRepetition(Repetition node) {
            ObjectNode n = typed("repetition");
            n.put("min", node.min);
            n.put("max", node.max);
            n.set("child", node.child.accept(this));
            return n;
        }

        @Override
        public ObjectNode visitSeries(Series node) {
            ObjectNode n = typed("series");
            ArrayNode children = n.putArray("children");
            for (Node child : node.children()) children.add(child.accept(this));
            return n;
        }

        @Override
        public ObjectNode visitAlternation(Alternation node) {
            ObjectNode n = typed("alternation");
            ArrayNode branches = n.putArray("branches");
            for (Node branch : node.branches()) branches.add(branch.accept(this));
            return n;
        }

        @Override
        public ObjectNode visitVariableReference(VariableReference node) {
            ObjectNode n = typed("variable");
            n.put("name", node.name);
            return n;
        }
    }
}
