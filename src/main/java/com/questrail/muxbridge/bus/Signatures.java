package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.util.Jsons;

import java.util.List;

/**
 * JSON shapes of D-Bus type signatures.
 *
 * <p>Only the outer shape of a value is checked: strings for {@code s o g},
 * booleans for {@code b}, numbers for the integer and double types, arrays for
 * {@code a...}, objects for dictionaries {@code a{...}} and variants. Anything
 * else is accepted.</p>
 */
public final class Signatures
{
    private Signatures() {}

    public static ObjectNode variant(String type, JsonNode value)
    {
        ObjectNode variant = Jsons.object();
        variant.put("t", type);
        variant.set("v", value);
        return variant;
    }

    public static boolean isVariant(JsonNode node)
    {
        return node != null && node.isObject() && node.path("t").isTextual() && node.has("v");
    }

    public static boolean matches(String type, JsonNode value)
    {
        if (value == null || type.isEmpty()) {
            return false;
        }
        switch (type.charAt(0)) {
            case 's':
            case 'o':
            case 'g':
                return value.isTextual();
            case 'b':
                return value.isBoolean();
            case 'y':
            case 'n':
            case 'q':
            case 'i':
            case 'u':
            case 'x':
            case 't':
                return value.isIntegralNumber();
            case 'd':
                return value.isNumber();
            case 'v':
                return isVariant(value);
            case 'a':
                return type.startsWith("a{") ? value.isObject() : value.isArray();
            default:
                return true;
        }
    }

    /**
     * @throws BusError {@code InvalidArgs} unless {@code args} has one matching value per type
     */
    public static void check(List<String> types, JsonNode args) throws BusError
    {
        if (args == null || !args.isArray() || args.size() != types.size()) {
            throw BusError.invalidArgs("Expected " + types.size() + " arguments");
        }
        for (int i = 0; i < types.size(); i++) {
            if (!matches(types.get(i), args.get(i))) {
                throw BusError.invalidArgs("Argument " + i + " does not match type '" + types.get(i) + "'");
            }
        }
    }
}
