package work.leyline.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.List;
import work.leyline.ast.Bullet;
import work.leyline.ast.CodeNode;
import work.leyline.ast.Container;
import work.leyline.ast.CorporealMacro;
import work.leyline.ast.Figure;
import work.leyline.ast.ListBlock;
import work.leyline.ast.Node;
import work.leyline.ast.NodeVisitor;
import work.leyline.ast.RenderFor;
import work.leyline.ast.Table;
import work.leyline.ast.TextNode;
import work.leyline.ast.With;

/**
 * Exports a tree as JSON. Every node becomes an object with {@code type}, {@code line},
 * {@code column} and its own fields; child sequences are arrays.
 */
public final class TreeExporter implements NodeVisitor<ObjectNode> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static ObjectNode toJson(Node node) {
        return node.accept(new TreeExporter());
    }

    public static String toJsonString(Node node, boolean pretty) {
        try {
            ObjectNode tree = toJson(node);
            return pretty ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(tree) : JSON.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public ObjectNode visitContainer(Container node) {
        ObjectNode json = header(node);
        json.set("body", nodes(node.body()));
        return json;
    }

    @Override
    public ObjectNode visitText(TextNode node) {
        return header(node).put("text", node.text());
    }

    @Override
    public ObjectNode visitCode(CodeNode node) {
        return header(node).put("lang", node.lang()).put("text", node.text());
    }

    @Override
    public ObjectNode visitWith(With node) {
        return header(node).put("ctx", node.ctx()).put("text", node.text());
    }

    @Override
    public ObjectNode visitRenderFor(RenderFor node) {
        ObjectNode json = header(node);
        ArrayNode targets = json.putArray("targets");
        node.targets().forEach(targets::add);
        json.set("body", nodes(node.body()));
        return json;
    }

    @Override
    public ObjectNode visitCorporealMacro(CorporealMacro node) {
        ObjectNode json = header(node).put("name", node.name());
        ArrayNode args = json.putArray("args");
        node.args().forEach(args::add);
        json.set("body", nodes(node.body()));
        return json;
    }

    @Override
    public ObjectNode visitListBlock(ListBlock node) {
        ObjectNode json = header(node);
        if (node.bullets().isShared()) {
            json.set("bullets", bullet(node.bullets().shared()));
        } else {
            ArrayNode bullets = json.putArray("bullets");
            for (Bullet bullet : node.bullets().sequence()) {
                bullets.add(bullet(bullet));
            }
        }
        ArrayNode items = json.putArray("items");
        for (List<Node> item : node.items()) {
            items.add(nodes(item));
        }
        return json;
    }

    @Override
    public ObjectNode visitTable(Table node) {
        ObjectNode json = header(node).put("header_rows", node.headerRows()).put("header_cols", node.headerCols());
        if (node.widths().isAuto()) {
            json.put("widths", "auto");
        } else {
            ArrayNode widths = json.putArray("widths");
            node.widths().fractions().forEach(widths::add);
        }
        ArrayNode rows = json.putArray("rows");
        for (List<List<Node>> row : node.rows()) {
            ArrayNode cells = rows.addArray();
            for (List<Node> cell : row) {
                cells.add(nodes(cell));
            }
        }
        return json;
    }

    @Override
    public ObjectNode visitFigure(Figure node) {
        ObjectNode json = header(node).put("path", node.path()).put("align", node.align()).put("scale", node.scale());
        json.set("caption", nodes(node.caption()));
        return json;
    }

    private ObjectNode header(Node node) {
        return NODES.objectNode()
            .put("type", node.getClass().getSimpleName())
            .put("line", node.line())
            .put("column", node.column());
    }

    private ArrayNode nodes(List<Node> nodes) {
        ArrayNode array = NODES.arrayNode();
        for (Node node : nodes) {
            array.add(node.accept(this));
        }
        return array;
    }

    private static JsonNode bullet(Bullet bullet) {
        return bullet.isNumbered() ? NODES.numberNode(bullet.number()) : NODES.textNode(bullet.symbol());
    }
}
