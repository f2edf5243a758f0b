package io.pagesync.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.state.PropValue;
import io.pagesync.core.state.Props;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coercion between JSON and {@link PropValue}.
 *
 * <p>Strings shaped {@code yyyy-MM-dd} that parse as calendar dates become {@link PropValue.Date};
 * numbers become {@link PropValue.Number} and must be writable in plain notation; {@code null} values
 * are dropped; nested objects are malformed.
 */
final class PropsJson {

    // Jackson refuses to write a BigDecimal as plain text beyond this scale magnitude
    static final int MAX_PLAIN_SCALE = 9999;

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private PropsJson() {}

    static Props read(JsonNode node) {
        if (node == null || node.isNull()) return Props.empty();
        if (!node.isObject()) {
            throw new ProtocolError("'p' must be an object");
        }
        Map<String, PropValue> values = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isNull()) continue;
            values.put(e.getKey(), readValue(e.getKey(), e.getValue()));
        }
        return Props.of(values);
    }

    static PropValue readValue(String key, JsonNode v) {
        if (v.isArray()) {
            List<PropValue> items = new ArrayList<>(v.size());
            for (JsonNode item : v) {
                if (item.isNull()) continue;
                if (item.isContainerNode()) {
                    throw new ProtocolError("'" + key + "' arrays may only contain scalars");
                }
                items.add(readScalar(key, item));
            }
            return new PropValue.Array(items);
        }
        return readScalar(key, v);
    }

    private static PropValue readScalar(String key, JsonNode v) {
        if (v.isTextual()) {
            String s = v.textValue();
            if (ISO_DATE.matcher(s).matches()) {
                try {
                    return PropValue.date(LocalDate.parse(s));
                } catch (DateTimeParseException e) {
                    return PropValue.text(s);
                }
            }
            return PropValue.text(s);
        }
        if (v.isNumber()) {
            PropValue.Number num = (PropValue.Number) PropValue.number(v.decimalValue());
            if (Math.abs(num.value().scale()) > MAX_PLAIN_SCALE) {
                throw new ProtocolError("'" + key + "' number " + num.value() + " cannot be written without an exponent");
            }
            return num;
        }
        if (v.isBoolean()) return PropValue.bool(v.booleanValue());
        throw new ProtocolError("'" + key + "' has unsupported value type " + v.getNodeType());
    }

    static ObjectNode write(ObjectMapper mapper, Props props) {
        ObjectNode n = mapper.createObjectNode();
        props.asMap().forEach((k, v) -> n.set(k, writeValue(mapper, v)));
        return n;
    }

    static JsonNode writeValue(ObjectMapper mapper, PropValue value) {
        if (value instanceof PropValue.Text t) return mapper.getNodeFactory().textNode(t.value());
        if (value instanceof PropValue.Number num) return mapper.getNodeFactory().numberNode(num.value());
        if (value instanceof PropValue.Bool b) return mapper.getNodeFactory().booleanNode(b.value());
        if (value instanceof PropValue.Date d) return mapper.getNodeFactory().textNode(d.value().toString());
        ArrayNode arr = mapper.createArrayNode();
        for (PropValue item : ((PropValue.Array) value).items()) {
            arr.add(writeValue(mapper, item));
        }
        return arr;
    }

    /** Plain Java form used for canonical snapshot JSON. */
    static Object toPlain(PropValue value) {
        if (value instanceof PropValue.Text t) return t.value();
        if (value instanceof PropValue.Number num) return num.value();
        if (value instanceof PropValue.Bool b) return b.value();
        if (value instanceof PropValue.Date d) return d.value().toString();
        List<Object> out = new ArrayList<>();
        for (PropValue item : ((PropValue.Array) value).items()) {
            out.add(toPlain(item));
        }
        return out;
    }
}
