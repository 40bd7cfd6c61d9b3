package wiringdiagrams.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.BoxKind;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * JSON interchange for wiring diagrams.
 *
 * <pre>{@code
 * {
 *   "inputs": ["A"], "outputs": ["B"],
 *   "boxes": [{"id": 1, "kind": "atomic", "value": "f", "inputs": ["A"], "outputs": ["B"]}],
 *   "wires": [{"source": {"box": "input", "port": 1}, "target": {"box": 1, "port": 1}}]
 * }
 * }</pre>
 *
 * Junction boxes carry integer {@code inputs}/{@code outputs}; generator boxes only a value. All
 * values are written with {@code String.valueOf} and read back as strings.
 */
public final class DiagramJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
  private static final String INPUT = "input";
  private static final String OUTPUT = "output";

  private DiagramJson() {}

  /** A parsed diagram together with the mapping from file box ids to diagram box ids. */
  public record Loaded(WiringDiagram diagram, Map<Integer, Integer> ids) {

    public Loaded {
      Objects.requireNonNull(diagram, "diagram");
      ids = Collections.unmodifiableMap(new LinkedHashMap<>(ids));
    }

    /** Diagram id for a file id; boundary ids map to themselves. */
    public int diagramId(int fileId) {
      if (WiringDiagram.isBoundary(fileId)) {
        return fileId;
      }
      Integer id = ids.get(fileId);
      if (id == null) {
        throw new IllegalArgumentException("No box with id " + fileId + " in the document");
      }
      return id;
    }

    /** Inverse of {@link #diagramId}. */
    public int fileId(int diagramId) {
      if (WiringDiagram.isBoundary(diagramId)) {
        return diagramId;
      }
      for (Map.Entry<Integer, Integer> entry : ids.entrySet()) {
        if (entry.getValue() == diagramId) {
          return entry.getKey();
        }
      }
      throw new IllegalArgumentException("Box " + diagramId + " did not come from the document");
    }
  }

  public static String write(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("inputs", strings(diagram.inputPorts()));
    root.put("outputs", strings(diagram.outputPorts()));

    List<Map<String, Object>> boxes = new ArrayList<>();
    for (int id : diagram.boxIds()) {
      Box box = diagram.box(id);
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", id);
      entry.put("kind", box.kind().name().toLowerCase(Locale.ROOT));
      entry.put("value", String.valueOf(box.value()));
      if (box.kind() == BoxKind.ATOMIC) {
        entry.put("inputs", strings(box.inputPorts()));
        entry.put("outputs", strings(box.outputPorts()));
      } else if (box.kind() == BoxKind.JUNCTION) {
        entry.put("inputs", box.inputCount());
        entry.put("outputs", box.outputCount());
      }
      boxes.add(entry);
    }
    root.put("boxes", boxes);

    List<Map<String, Object>> wires = new ArrayList<>();
    for (Wire wire : diagram.wires()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("source", endpoint(wire.source()));
      entry.put("target", endpoint(wire.target()));
      wires.add(entry);
    }
    root.put("wires", wires);
    return GSON.toJson(root);
  }

  public static void write(WiringDiagram diagram, Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Files.writeString(file, write(diagram) + System.lineSeparator(), StandardCharsets.UTF_8);
  }

  public static WiringDiagram read(String json) {
    return load(json).diagram();
  }

  public static Loaded load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    return load(Files.readString(file, StandardCharsets.UTF_8));
  }

  public static Loaded load(String json) {
    Objects.requireNonNull(json, "json");
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Malformed diagram JSON: " + ex.getMessage(), ex);
    }
    if (!parsed.isJsonObject()) {
      throw new IllegalArgumentException("Expected a JSON object at the top level");
    }
    JsonObject root = parsed.getAsJsonObject();
    WiringDiagram diagram =
        new WiringDiagram(
            readStrings(root, "inputs", "diagram"), readStrings(root, "outputs", "diagram"));

    Map<Integer, Integer> ids = new LinkedHashMap<>();
    for (JsonElement element : optionalArray(root, "boxes")) {
      JsonObject obj = requireObject(element, "box");
      int fileId = readInt(obj, "id", "box");
      if (fileId < 1) {
        throw new IllegalArgumentException("Box ids must be positive, got " + fileId);
      }
      if (ids.containsKey(fileId)) {
        throw new IllegalArgumentException("Duplicate box id " + fileId);
      }
      ids.put(fileId, diagram.addBox(readBox(obj)));
    }

    List<Wire> wires = new ArrayList<>();
    for (JsonElement element : optionalArray(root, "wires")) {
      JsonObject obj = requireObject(element, "wire");
      Port source = readEndpoint(obj, "source", ids, true);
      Port target = readEndpoint(obj, "target", ids, false);
      wires.add(new Wire(source, target));
    }
    diagram.addWires(wires);
    return new Loaded(diagram, ids);
  }

  private static Box readBox(JsonObject obj) {
    String kindName = readString(obj, "kind", "box");
    BoxKind kind;
    try {
      kind = BoxKind.valueOf(kindName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown box kind: " + kindName, ex);
    }
    String value = readString(obj, "value", "box");
    return switch (kind) {
      case ATOMIC -> Box.atomic(
          value,
          readStrings(obj, "inputs", "atomic box"),
          readStrings(obj, "outputs", "atomic box"));
      case COPY -> Box.copy(value);
      case MERGE -> Box.merge(value);
      case DELETE -> Box.delete(value);
      case CREATE -> Box.create(value);
      case JUNCTION -> Box.junction(
          value, readInt(obj, "inputs", "junction"), readInt(obj, "outputs", "junction"));
    };
  }

  private static Port readEndpoint(
      JsonObject wire, String field, Map<Integer, Integer> ids, boolean source) {
    JsonObject obj = requireObject(wire.get(field), "wire " + field);
    JsonElement boxElement = obj.get("box");
    if (boxElement == null || boxElement.isJsonNull()) {
      throw new IllegalArgumentException("Missing 'box' in wire " + field);
    }
    int box;
    if (boxElement.isJsonPrimitive() && boxElement.getAsJsonPrimitive().isString()) {
      box = boundaryId(boxElement.getAsString());
    } else {
      int fileId = readInt(obj, "box", "wire " + field);
      Integer mapped = ids.get(fileId);
      if (mapped == null) {
        throw new IllegalArgumentException("Wire " + field + " refers to unknown box " + fileId);
      }
      box = mapped;
    }
    int port = readInt(obj, "port", "wire " + field);
    return source ? Port.output(box, port) : Port.input(box, port);
  }

  static int boundaryId(String name) {
    return switch (name) {
      case INPUT -> WiringDiagram.INPUT_ID;
      case OUTPUT -> WiringDiagram.OUTPUT_ID;
      default -> throw new IllegalArgumentException("Unknown boundary name: " + name);
    };
  }

  private static Map<String, Object> endpoint(Port port) {
    Map<String, Object> entry = new LinkedHashMap<>();
    if (port.box() == WiringDiagram.INPUT_ID) {
      entry.put("box", INPUT);
    } else if (port.box() == WiringDiagram.OUTPUT_ID) {
      entry.put("box", OUTPUT);
    } else {
      entry.put("box", port.box());
    }
    entry.put("port", port.port());
    return entry;
  }

  private static List<String> strings(List<Object> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Object value : values) {
      out.add(String.valueOf(value));
    }
    return out;
  }

  private static JsonArray optionalArray(JsonObject obj, String field) {
    JsonElement element = obj.get(field);
    if (element == null || element.isJsonNull()) {
      return new JsonArray();
    }
    if (!element.isJsonArray()) {
      throw new IllegalArgumentException("Expected '" + field + "' to be an array");
    }
    return element.getAsJsonArray();
  }

  private static List<Object> readStrings(JsonObject obj, String field, String context) {
    List<Object> values = new ArrayList<>();
    for (JsonElement element : optionalArray(obj, field)) {
      if (!element.isJsonPrimitive()) {
        throw new IllegalArgumentException(
            "Expected scalar port values in '" + field + "' of " + context);
      }
      values.add(element.getAsString());
    }
    return values;
  }

  private static JsonObject requireObject(JsonElement element, String context) {
    if (element == null || !element.isJsonObject()) {
      throw new IllegalArgumentException("Expected an object for " + context + ": " + element);
    }
    return element.getAsJsonObject();
  }

  private static String readString(JsonObject obj, String field, String context) {
    JsonElement element = obj.get(field);
    if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
      throw new IllegalArgumentException("Missing '" + field + "' in " + context);
    }
    return element.getAsString();
  }

  private static int readInt(JsonObject obj, String field, String context) {
    JsonElement element = obj.get(field);
    if (element == null
        || !element.isJsonPrimitive()
        || !element.getAsJsonPrimitive().isNumber()) {
      throw new IllegalArgumentException("Expected integer '" + field + "' in " + context);
    }
    try {
      return element.getAsBigDecimal().intValueExact();
    } catch (ArithmeticException | NumberFormatException ex) {
      throw new IllegalArgumentException("Expected integer '" + field + "' in " + context, ex);
    }
  }
}
