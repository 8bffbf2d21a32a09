package io.repokeeper.core.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Converts list and map columns to and from JSON text.
 */
public class JsonColumnMapper
{
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<Map<String, String>>() {};

    private final ObjectMapper mapper;

    @Inject
    public JsonColumnMapper(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    public String toText(Object value)
    {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value can't be stored as JSON: " + value, ex);
        }
    }

    public List<String> stringListFromResultSet(ResultSet rs, String column)
            throws SQLException
    {
        return fromText(rs.getString(column), STRING_LIST);
    }

    public Map<String, String> stringMapFromResultSet(ResultSet rs, String column)
            throws SQLException
    {
        return fromText(rs.getString(column), STRING_MAP);
    }

    private <T> T fromText(String text, TypeReference<T> type)
            throws SQLException
    {
        try {
            return mapper.readValue(text, type);
        }
        catch (JsonProcessingException ex) {
            throw new SQLException("Stored JSON column is broken: " + text, ex);
        }
    }
}
