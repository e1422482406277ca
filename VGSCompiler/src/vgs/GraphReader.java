package vgs;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * Reads the editor's project JSON. Accepts the serialized-project form {@code {"version",
 * "data": {"metadata", "settings", "nodes", "connections"}}} as well as a bare {@code {"metadata",
 * "nodes", "connections"}} object. Positions and settings are ignored.
 */
public final class GraphReader {
  private static final Logger log = LoggerFactory.getLogger(GraphReader.class);

  public static final String FORMAT_VERSION = "1.0.0";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private GraphReader() {}

  public static Project read(File file) throws IOException, CompilerException {
    return read(Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  public static Project read(String json) throws CompilerException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new CompilerException("malformed project JSON: " + ex.getOriginalMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      throw new CompilerException("project JSON must be an object");
    }

    ObjectNode document;
    JsonNode data;
    if (root.path("data").isObject()) {
      document = (ObjectNode) root;
      data = root.get("data");
    } else {
      document = MAPPER.createObjectNode();
      document.put("version", FORMAT_VERSION);
      document.set("data", root);
      data = root;
    }

    ProjectMetadata metadata = readMetadata(data.path("metadata"));

    Graph.Builder graph = Graph.builder();
    for (JsonNode node : requireArray(data, "nodes")) {
      graph.addNode(readNode(node));
    }
    int index = 0;
    for (JsonNode connection : requireArray(data, "connections")) {
      graph.addConnection(readConnection(connection, index++));
    }

    try {
      return Project.create(metadata, graph.build(), MAPPER.writeValueAsString(document));
    } catch (JsonProcessingException ex) {
      throw new CompilerException("could not serialize project document", ex);
    }
  }

  private static ProjectMetadata readMetadata(JsonNode json) {
    ProjectMetadata.Builder builder = ProjectMetadata.builder();
    if (!json.isObject()) {
      return builder.build();
    }

    optionalText(json, "name").ifPresent(builder::setName);
    optionalText(json, "version").ifPresent(builder::setVersion);
    optionalText(json, "author").ifPresent(builder::setAuthor);
    optionalText(json, "description").ifPresent(builder::setDescription);
    optionalText(json, "editorVersion").ifPresent(builder::setEditorVersion);
    return builder.build();
  }

  private static Graph.Node readNode(JsonNode json) throws CompilerException {
    if (!json.isObject()) {
      throw new CompilerException("node entries must be objects");
    }
    String id = requireText(json, "id", Optional.empty());
    String type = requireText(json, "type", Optional.of(id));

    Graph.Node.Builder builder = Graph.Node.builder(id, type);
    optionalText(json, "category").ifPresent(builder::setCategory);
    optionalText(json, "label").ifPresent(builder::setLabel);

    JsonNode data = json.path("data");
    Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      builder.putData(field.getKey(), readLiteral(id, field.getKey(), field.getValue()));
    }

    for (JsonNode port : json.path("inputs")) {
      builder.addInput(readPort(id, port));
    }
    for (JsonNode port : json.path("outputs")) {
      builder.addOutput(readPort(id, port));
    }
    return builder.build();
  }

  private static Graph.Port readPort(String nodeId, JsonNode json) throws CompilerException {
    if (!json.isObject()) {
      throw new CompilerException(nodeId, "port entries must be objects");
    }
    String id = requireText(json, "id", Optional.of(nodeId));
    String label = optionalText(json, "label").orElse("");

    // The editor writes the port kind as "type"; "kind" is accepted too.
    String kind = optionalText(json, "type").orElse(optionalText(json, "kind").orElse(""));
    Graph.PortKind portKind =
        Ascii.equalsIgnoreCase(kind, "exec") ? Graph.PortKind.EXEC : Graph.PortKind.DATA;

    return Graph.Port.create(id, label, portKind, optionalText(json, "dataType"));
  }

  private static Graph.Connection readConnection(JsonNode json, int index)
      throws CompilerException {
    if (!json.isObject()) {
      throw new CompilerException("connection entries must be objects");
    }
    String id = optionalText(json, "id").orElse("conn_" + index);
    return Graph.Connection.create(
        id, readEndpoint(json.path("from"), id), readEndpoint(json.path("to"), id));
  }

  private static Graph.Endpoint readEndpoint(JsonNode json, String connectionId)
      throws CompilerException {
    Optional<String> nodeId = optionalText(json, "nodeId");
    Optional<String> portId = optionalText(json, "portId");
    if (!nodeId.isPresent() || !portId.isPresent()) {
      throw new CompilerException(
          String.format("connection '%s' is missing an endpoint nodeId or portId", connectionId));
    }
    return Graph.Endpoint.of(nodeId.get(), portId.get());
  }

  static Literal readLiteral(String nodeId, String key, JsonNode json) {
    if (json.isBoolean()) {
      return Literal.of(json.booleanValue());
    } else if (json.isNumber()) {
      return Literal.of(json.decimalValue());
    } else if (json.isTextual()) {
      return Literal.of(json.textValue());
    } else if (json.isArray()) {
      ImmutableList.Builder<Literal> elements = ImmutableList.builder();
      for (JsonNode element : json) {
        elements.add(readLiteral(nodeId, key, element));
      }
      return Literal.array(elements.build());
    } else if (json.isObject()) {
      log.warn(
          "Node '{}': object value for data key '{}' is not supported; using null", nodeId, key);
    }
    return Literal.nullValue();
  }

  private static String requireText(JsonNode json, String field, Optional<String> nodeId)
      throws CompilerException {
    Optional<String> text = optionalText(json, field);
    if (text.isPresent()) {
      return text.get();
    }

    String msg = String.format("missing required field '%s'", field);
    if (nodeId.isPresent()) {
      throw new CompilerException(nodeId.get(), msg);
    }
    throw new CompilerException(msg);
  }

  private static Optional<String> optionalText(JsonNode json, String field) {
    JsonNode value = json.get(field);
    return value != null && value.isTextual() ? Optional.of(value.textValue()) : Optional.empty();
  }

  private static JsonNode requireArray(JsonNode json, String field) throws CompilerException {
    JsonNode value = json.get(field);
    if (value == null || !value.isArray()) {
      throw new CompilerException(String.format("project is missing the '%s' array", field));
    }
    return value;
  }
}
