package com.ttlcache.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalLong;

/**
 * Best-effort size of a cached value: the length of its JSON form.
 * Values Jackson cannot serialize (self references, self-containing collections,
 * beans without properties) are reported as unmeasurable instead of failing.
 */
@Slf4j
public class ValueSizer {
    
    private final ObjectMapper objectMapper;
    
    public ValueSizer() {
        this(new ObjectMapper());
    }
    
    public ValueSizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public OptionalLong sizeOf(Object value) {
        try {
            return OptionalLong.of(objectMapper.writeValueAsString(value).length());
        } catch (JsonProcessingException e) {
            return unmeasurable(value, e.getOriginalMessage());
        } catch (RuntimeException e) {
            return unmeasurable(value, e.getMessage());
        } catch (StackOverflowError e) {
            // Collections that contain themselves recurse until the stack runs out
            return unmeasurable(value, "self-referencing structure");
        }
    }
    
    private OptionalLong unmeasurable(Object value, String reason) {
        log.warn("Failed to calculate size for cache value of type {}: {}",
                value == null ? "null" : value.getClass().getName(), reason);
        return OptionalLong.empty();
    }
}
