package org.mides.routeplanner.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.mides.routeplanner.model.Priority;

import java.io.IOException;

public class PriorityDeserializer extends JsonDeserializer<Priority> {

    @Override
    public Priority deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String priority = p.getText();
        try {
            return Priority.valueOf(priority.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown priority " + priority, e);
        }
    }
}
