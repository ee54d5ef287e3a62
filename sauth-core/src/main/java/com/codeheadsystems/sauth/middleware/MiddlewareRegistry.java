package com.codeheadsystems.sauth.middleware;

import com.codeheadsystems.sauth.credential.InvalidConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed table of {@link MiddlewareSpec}s, with JSON round-tripping of configured
 * middleware instances.
 */
public class MiddlewareRegistry {

  private final ConcurrentHashMap<String, MiddlewareSpec<?>> specs = new ConcurrentHashMap<>();
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Middleware registry.
   *
   * @param objectMapper mapper used for serialized instances
   */
  public MiddlewareRegistry(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Registers a spec.
   *
   * @param spec the spec
   * @throws IllegalArgumentException if the spec is null, has a blank type, or its type is taken
   */
  public void addSpec(MiddlewareSpec<?> spec) {
    if (spec == null) {
      throw new IllegalArgumentException("Middleware spec must not be null");
    }
    String type = spec.type();
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Middleware spec type must not be blank");
    }
    if (spec.middlewareClass() == null) {
      throw new IllegalArgumentException("Middleware spec " + type + " has no middleware class");
    }
    if (specs.putIfAbsent(type, spec) != null) {
      throw new IllegalArgumentException("Middleware type already registered: " + type);
    }
  }

  /**
   * Looks up a spec by type.
   *
   * @param type the type
   * @return the spec, if registered
   */
  public Optional<MiddlewareSpec<?>> getSpec(String type) {
    return Optional.ofNullable(specs.get(type));
  }

  /**
   * Registered type identifiers.
   *
   * @return the types
   */
  public Set<String> types() {
    return Set.copyOf(specs.keySet());
  }

  /**
   * Serializes a configured middleware.
   *
   * @param middleware the middleware
   * @return its JSON form
   */
  public String toJson(Object middleware) {
    try {
      return objectMapper.writeValueAsString(middleware);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Unable to serialize middleware", e);
    }
  }

  /**
   * Rebuilds a middleware of the given type from its JSON form via {@link MiddlewareSpec#fromOther}.
   *
   * @param type the middleware type
   * @param json the serialized instance
   * @return the rebuilt middleware
   * @throws IllegalArgumentException      if the type is unknown or the JSON is unreadable
   * @throws InvalidConfigurationException if the serialized configuration is invalid
   */
  public Object fromJson(String type, String json) {
    MiddlewareSpec<?> spec = getSpec(type)
        .orElseThrow(() -> new IllegalArgumentException("Unknown middleware type: " + type));
    return rebuild(spec, json);
  }

  private <M> M rebuild(MiddlewareSpec<M> spec, String json) {
    M prior;
    try {
      prior = objectMapper.readValue(json, spec.middlewareClass());
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof InvalidConfigurationException cause) {
        throw cause;
      }
      throw new IllegalArgumentException("Unreadable " + spec.type() + " middleware", e);
    }
    return spec.fromOther(prior);
  }
}
