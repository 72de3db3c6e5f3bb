package com.Excel.Book.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;

/**
 * Reads xsd:boolean attribute values, which spreadsheet producers write as
 * either "1"/"0" or "true"/"false".
 */
public class XmlBooleanDeserializer extends StdScalarDeserializer<Boolean> {

    public XmlBooleanDeserializer() {
        super(Boolean.class);
    }

    @Override
    public Boolean deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != null && p.currentToken().isBoolean()) {
            return p.getBooleanValue();
        }
        String text = p.getValueAsString();
        if (text == null) {
            return null;
        }
        switch (text.trim().toLowerCase()) {
            case "1":
            case "true":
                return Boolean.TRUE;
            case "0":
            case "false":
                return Boolean.FALSE;
            case "":
                return null;
            default:
                return (Boolean) ctxt.handleWeirdStringValue(Boolean.class, text,
                        "expected one of \"1\", \"0\", \"true\" or \"false\"");
        }
    }
}
