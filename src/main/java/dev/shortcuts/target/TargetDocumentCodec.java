package dev.shortcuts.target;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shortcuts.model.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Frames target documents as JSON or as property list text, and reads them back.
 * Binary property lists go through a {@link NativeFormatConverter}.
 */
public final class TargetDocumentCodec {

    private static final Logger logger = LoggerFactory.getLogger(TargetDocumentCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final byte[] BINARY_MAGIC = "bplist".getBytes(StandardCharsets.US_ASCII);
    private static final String PLIST_DOCTYPE =
        "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">";

    public enum Framing { JSON, XML, BINARY }

    /** Encoded bytes and the framing actually produced. */
    public record Encoded(byte[] data, Framing framing) {}

    private TargetDocumentCodec() {}

    // --- tree form ---

    public static ObjectNode toTree(TargetDocument document) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode root = nodes.objectNode();
        root.put("WFWorkflowName", document.name());
        ObjectNode icon = root.putObject("WFWorkflowIcon");
        icon.put("WFWorkflowIconStartColor", document.icon().startColor());
        icon.put("WFWorkflowIconGlyphNumber", document.icon().glyphNumber());
        root.put("WFWorkflowClientVersion", document.clientVersion());
        root.put("WFWorkflowClientRelease", document.clientRelease());
        root.put("WFWorkflowMinimumClientVersion", document.minimumClientVersion());
        root.put("WFWorkflowMinimumClientVersionString", String.valueOf(document.minimumClientVersion()));
        root.putArray("WFWorkflowImportQuestions");
        ArrayNode types = root.putArray("WFWorkflowTypes");
        document.workflowTypes().forEach(types::add);
        ArrayNode classes = root.putArray("WFWorkflowInputContentItemClasses");
        document.inputContentItemClasses().forEach(classes::add);
        ArrayNode actions = root.putArray("WFWorkflowActions");
        for (TargetAction action : document.actions()) {
            ObjectNode record = actions.addObject();
            record.put("WFWorkflowActionIdentifier", action.identifier());
            record.set("WFWorkflowActionParameters", action.parameters().deepCopy());
        }
        return root;
    }

    /** Lenient: missing root fields take the fixed client defaults. */
    public static TargetDocument fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Target document root must be a dictionary");
        }
        JsonNode icon = root.path("WFWorkflowIcon");
        var workflowIcon = new WorkflowIcon(
            icon.path("WFWorkflowIconStartColor").asLong(WorkflowIcon.DEFAULT_START_COLOR),
            icon.path("WFWorkflowIconGlyphNumber").asLong(WorkflowIcon.DEFAULT_GLYPH));
        var actions = new ArrayList<TargetAction>();
        for (JsonNode record : root.path("WFWorkflowActions")) {
            JsonNode parameters = record.path("WFWorkflowActionParameters");
            actions.add(new TargetAction(
                record.path("WFWorkflowActionIdentifier").asText(null),
                parameters.isObject() ? ((ObjectNode) parameters).deepCopy() : JsonNodeFactory.instance.objectNode()));
        }
        return new TargetDocument(
            root.path("WFWorkflowName").asText(null),
            workflowIcon,
            root.path("WFWorkflowClientVersion").asText(TargetDocument.CLIENT_VERSION),
            root.path("WFWorkflowClientRelease").asText(TargetDocument.CLIENT_RELEASE),
            root.path("WFWorkflowMinimumClientVersion").asInt(TargetDocument.MINIMUM_CLIENT_VERSION),
            strings(root.path("WFWorkflowTypes"), TargetDocument.WORKFLOW_TYPES),
            strings(root.path("WFWorkflowInputContentItemClasses"), TargetDocument.INPUT_CONTENT_ITEM_CLASSES),
            actions);
    }

    private static List<String> strings(JsonNode array, List<String> fallback) {
        if (!array.isArray()) {
            return fallback;
        }
        var values = new ArrayList<String>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }

    // --- JSON framing ---

    public static String writeJson(TargetDocument document) {
        try {
            return MAPPER.writeValueAsString(toTree(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize target document", e);
        }
    }

    public static TargetDocument readJson(String json) throws IOException {
        return fromTree(MAPPER.readTree(json));
    }

    // --- property list text framing ---

    public static String writeXml(TargetDocument document) {
        var out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory().createXMLStreamWriter(out, "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeDTD(PLIST_DOCTYPE);
            xml.writeCharacters("\n");
            xml.writeStartElement("plist");
            xml.writeAttribute("version", "1.0");
            writePlistValue(xml, toTree(document));
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Could not write property list", e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static void writePlistValue(XMLStreamWriter xml, JsonNode node) throws XMLStreamException {
        if (node.isObject()) {
            xml.writeStartElement("dict");
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                // property lists have no null
                if (field.getValue().isNull()) {
                    continue;
                }
                element(xml, "key", field.getKey());
                writePlistValue(xml, field.getValue());
            }
            xml.writeEndElement();
        } else if (node.isArray()) {
            xml.writeStartElement("array");
            for (JsonNode item : node) {
                if (!item.isNull()) {
                    writePlistValue(xml, item);
                }
            }
            xml.writeEndElement();
        } else if (node.isBoolean()) {
            xml.writeEmptyElement(node.booleanValue() ? "true" : "false");
        } else if (node.isIntegralNumber()) {
            element(xml, "integer", node.bigIntegerValue().toString());
        } else if (node.isNumber()) {
            element(xml, "real", node.decimalValue().toPlainString());
        } else {
            element(xml, "string", node.asText());
        }
    }

    private static void element(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    public static TargetDocument readXml(String xml) throws IOException {
        Document dom;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            dom = builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Malformed property list: " + e.getMessage(), e);
        }
        Element plist = dom.getDocumentElement();
        if (!"plist".equals(plist.getTagName())) {
            throw new IOException("Expected a <plist> root element, got <" + plist.getTagName() + ">");
        }
        List<Element> children = childElements(plist);
        if (children.size() != 1) {
            throw new IOException("A property list holds exactly one root value");
        }
        return fromTree(readPlistValue(children.get(0)));
    }

    private static JsonNode readPlistValue(Element element) throws IOException {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        String text = element.getTextContent().trim();
        switch (element.getTagName()) {
            case "dict": {
                ObjectNode object = nodes.objectNode();
                List<Element> children = childElements(element);
                if (children.size() % 2 != 0) {
                    throw new IOException("Unbalanced <dict>: every <key> needs a value");
                }
                for (int i = 0; i < children.size(); i += 2) {
                    Element key = children.get(i);
                    if (!"key".equals(key.getTagName())) {
                        throw new IOException("Expected <key> in <dict>, got <" + key.getTagName() + ">");
                    }
                    object.set(key.getTextContent(), readPlistValue(children.get(i + 1)));
                }
                return object;
            }
            case "array": {
                ArrayNode array = nodes.arrayNode();
                for (Element child : childElements(element)) {
                    array.add(readPlistValue(child));
                }
                return array;
            }
            case "string":
            case "date":
            case "data":
                return nodes.textNode(element.getTextContent());
            case "integer":
                try {
                    return JsonValues.numberNode(new BigDecimal(new BigInteger(text)));
                } catch (NumberFormatException e) {
                    throw new IOException("Malformed <integer>: " + text, e);
                }
            case "real":
                try {
                    return nodes.numberNode(new BigDecimal(text));
                } catch (NumberFormatException e) {
                    throw new IOException("Malformed <real>: " + text, e);
                }
            case "true":
                return nodes.booleanNode(true);
            case "false":
                return nodes.booleanNode(false);
            default:
                throw new IOException("Unsupported property list element <" + element.getTagName() + ">");
        }
    }

    private static List<Element> childElements(Element parent) {
        var elements = new ArrayList<Element>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    // --- framing selection ---

    /**
     * Encodes in the requested framing. Binary falls back to property list text when the
     * converter is unavailable; the returned framing says which one was produced.
     */
    public static Encoded encode(TargetDocument document, Framing framing, NativeFormatConverter converter) {
        if (framing == Framing.JSON) {
            return new Encoded(writeJson(document).getBytes(StandardCharsets.UTF_8), Framing.JSON);
        }
        byte[] xml = writeXml(document).getBytes(StandardCharsets.UTF_8);
        if (framing == Framing.XML) {
            return new Encoded(xml, Framing.XML);
        }
        Conversion conversion = converter.toBinary(xml);
        if (conversion instanceof Conversion.Converted converted) {
            return new Encoded(converted.data(), Framing.BINARY);
        }
        logger.warn("Binary framing unavailable, writing property list text instead: {}",
            ((Conversion.Unavailable) conversion).reason());
        return new Encoded(xml, Framing.XML);
    }

    /** Detects binary, property list text, or JSON framing. */
    public static TargetDocument read(byte[] data, NativeFormatConverter converter) throws IOException {
        Framing framing = detect(data);
        if (framing == Framing.BINARY) {
            Conversion conversion = converter.toXml(data);
            if (conversion instanceof Conversion.Unavailable unavailable) {
                throw new IOException("Binary property list needs a native converter: " + unavailable.reason());
            }
            data = ((Conversion.Converted) conversion).data();
            framing = Framing.XML;
        }
        String text = new String(data, StandardCharsets.UTF_8);
        return framing == Framing.XML ? readXml(text) : readJson(text);
    }

    public static Framing detect(byte[] data) {
        if (startsWith(data, BINARY_MAGIC)) {
            return Framing.BINARY;
        }
        String head = new String(data, 0, Math.min(data.length, 256), StandardCharsets.UTF_8).stripLeading();
        if (head.startsWith("\uFEFF")) {
            head = head.substring(1).stripLeading();
        }
        return head.startsWith("<") ? Framing.XML : Framing.JSON;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
