package com.example.RagFlow.engine;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dispatch table from component type to handler. Every {@link ComponentHandler} bean is
 * registered, so a new component type only needs a new handler.
 */
@Component
public class ComponentHandlerRegistry {

    private final Map<String, ComponentHandler> handlersByType;

    public ComponentHandlerRegistry(List<ComponentHandler> handlers) {
        this.handlersByType = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ComponentHandler::type,
                        h -> h
                ));
    }

    public Optional<ComponentHandler> find(String type) {
        return Optional.ofNullable(type).map(handlersByType::get);
    }

    public Set<String> supportedTypes() {
        return handlersByType.keySet();
    }
}
