package com.questrail.muxbridge.bus;

import java.util.Objects;

/**
 * A named bus error, returned to the caller as an {@code error} reply.
 */
public class BusError extends Exception
{
    public static final String UNKNOWN_OBJECT = "org.freedesktop.DBus.Error.UnknownObject";
    public static final String UNKNOWN_INTERFACE = "org.freedesktop.DBus.Error.UnknownInterface";
    public static final String UNKNOWN_METHOD = "org.freedesktop.DBus.Error.UnknownMethod";
    public static final String UNKNOWN_PROPERTY = "org.freedesktop.DBus.Error.UnknownProperty";
    public static final String PROPERTY_READ_ONLY = "org.freedesktop.DBus.Error.PropertyReadOnly";
    public static final String INVALID_ARGS = "org.freedesktop.DBus.Error.InvalidArgs";

    private final String name;

    public BusError(String name, String message)
    {
        super(message);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name()
    {
        return name;
    }

    public static BusError unknownObject(String path)
    {
        return new BusError(UNKNOWN_OBJECT, "No such object path '" + path + "'");
    }

    public static BusError unknownInterface(String path, String iface)
    {
        return new BusError(UNKNOWN_INTERFACE, "Object " + path + " has no interface " + iface);
    }

    public static BusError unknownMethod(String iface, String method)
    {
        return new BusError(UNKNOWN_METHOD, "No method " + method + " on interface " + iface);
    }

    public static BusError unknownProperty(String iface, String property)
    {
        return new BusError(UNKNOWN_PROPERTY, "No property " + property + " on interface " + iface);
    }

    public static BusError readOnly(String iface, String property)
    {
        return new BusError(PROPERTY_READ_ONLY, "Property " + iface + "." + property + " is read-only");
    }

    public static BusError invalidArgs(String message)
    {
        return new BusError(INVALID_ARGS, message);
    }
}
