package io.github.drompincen.devicebridge.runtime.tools;

import io.github.drompincen.devicebridge.protocol.api.ToolDescriptor;
import io.github.drompincen.devicebridge.runtime.agent.AgentProperties;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.runtime.shell.ShellExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * The tools one device offers its agent, by name. Providers listed under
 * {@code META-INF/services} are discovered at startup and bound to the device's collaborators;
 * a provider that fails to load is skipped so the remaining tools stay usable.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final ToolBindings bindings;

    @Autowired
    public ToolRegistry(ObjectProvider<ShellExecutor> shellExecutor,
                        ObjectProvider<AutomationDriver> automationDriver,
                        ObjectProvider<AgentProperties> agentProperties) {
        this(new ToolBindings(shellExecutor.getIfAvailable(), automationDriver.getIfAvailable(),
                agentProperties.getIfAvailable()));
        discover(ToolRegistry.class.getClassLoader());
    }

    public ToolRegistry(ToolBindings bindings) {
        this.bindings = bindings;
    }

    /** Adopts every provider the class loader can see; returns how many were added. */
    public int discover(ClassLoader classLoader) {
        Iterator<Tool> providers = ServiceLoader.load(Tool.class, classLoader).iterator();
        int added = 0;
        while (true) {
            try {
                if (!providers.hasNext()) break;
                if (register(providers.next())) added++;
            } catch (ServiceConfigurationError e) {
                // the loader moves on to the next listed provider
                log.warn("[tool] skipping provider: {}", e.getMessage());
            }
        }
        log.info("[tool] {} tool(s) available: {}", tools.size(), names());
        return added;
    }

    /** Binds and adds the tool. A second tool with a name already taken is refused. */
    public synchronized boolean register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            log.warn("[tool] '{}' already provided by {}, ignoring {}", tool.name(),
                    tools.get(tool.name()).getClass().getName(), tool.getClass().getName());
            return false;
        }
        tool.bind(bindings);
        tools.put(tool.name(), tool);
        log.debug("[tool] registered '{}'", tool.name());
        return true;
    }

    public synchronized Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<Tool> all() {
        return List.copyOf(tools.values());
    }

    public synchronized List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<ToolDescriptor> descriptors() {
        return all().stream()
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema()))
                .toList();
    }
}
