package org.cuepoint.compiler.operations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cuepoint.compiler.ir.IrArgument;
import org.cuepoint.compiler.ir.IrValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * The fixed catalog of built-in operations and controllers known to the runtime.
 * <p>
 * The catalog is read once from the {@code operations.json} classpath resource and is immutable afterwards.
 * {@code addController} is not a runtime operation; it expands into
 * {@code getControllerInstance} and {@code addControllerToElement} when emitted.
 */
public final class OperationCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(OperationCatalog.class);

    /** The resource the default catalog is loaded from. */
    public static final String DEFAULT_RESOURCE = "operations.json";

    /** The name of the controller sugar operation. */
    public static final String ADD_CONTROLLER = "addController";

    private final Map<String, OperationSignature> operations;
    private final Map<String, OperationSignature> controllers;

    /**
     * @param operations  Operation signatures by name.
     * @param controllers Controller signatures by name.
     */
    public OperationCatalog(Map<String, OperationSignature> operations, Map<String, OperationSignature> controllers) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.controllers = Collections.unmodifiableMap(new LinkedHashMap<>(controllers));
    }

    /**
     * Loads the catalog bundled with the compiler.
     *
     * @return The catalog.
     * @throws IllegalStateException if the resource is missing or malformed.
     */
    public static OperationCatalog loadDefault() {
        try (InputStream in = OperationCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Operation catalog resource '" + DEFAULT_RESOURCE + "' not found on classpath");
            }
            return parse(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operation catalog '" + DEFAULT_RESOURCE + "'", e);
        }
    }

    /**
     * Builds a catalog from its JSON form:
     * {@code {"operations": [{"name": ..., "parameters": [{"name", "type", "required"}]}], "controllers": [...]}}.
     *
     * @param root The JSON root.
     * @return The catalog.
     * @throws IllegalStateException if a parameter has an unknown type.
     */
    public static OperationCatalog parse(JsonNode root) {
        Map<String, OperationSignature> ops = readSignatures(root.path("operations"));
        Map<String, OperationSignature> ctrls = readSignatures(root.path("controllers"));
        LOG.debug("Loaded operation catalog with {} operations and {} controllers", ops.size(), ctrls.size());
        return new OperationCatalog(ops, ctrls);
    }

    private static Map<String, OperationSignature> readSignatures(JsonNode array) {
        Map<String, OperationSignature> out = new LinkedHashMap<>();
        for (JsonNode op : array) {
            String name = op.path("name").asText();
            List<OperationParameter> params = new ArrayList<>();
            for (JsonNode p : op.path("parameters")) {
                String typeName = p.path("type").asText("any");
                ParameterType type = ParameterType.fromJsonName(typeName)
                        .orElseThrow(() -> new IllegalStateException("Unknown parameter type '" + typeName + "' in operation " + name));
                params.add(new OperationParameter(p.path("name").asText(), type, p.path("required").asBoolean(true)));
            }
            out.put(name, new OperationSignature(name, params));
        }
        return out;
    }

    /**
     * @param name An operation name.
     * @return The signature, if the name is a built-in operation.
     */
    public Optional<OperationSignature> find(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    /**
     * @param name An operation name.
     * @return {@code true} if the name is a built-in operation.
     */
    public boolean contains(String name) {
        return operations.containsKey(name);
    }

    /**
     * @param name A controller name.
     * @return The controller signature, if known.
     */
    public Optional<OperationSignature> findController(String name) {
        return Optional.ofNullable(controllers.get(name));
    }

    /**
     * @return All operation names, sorted.
     */
    public List<String> operationNames() {
        return List.copyOf(new TreeSet<>(operations.keySet()));
    }

    /**
     * @return All controller names, sorted.
     */
    public List<String> controllerNames() {
        return List.copyOf(new TreeSet<>(controllers.keySet()));
    }

    /**
     * Matches the arguments of a built-in operation call to typed parameters. For
     * {@code addController} the first argument binds to the controller name and the remaining
     * ones to the parameters of the named controller.
     *
     * @param systemName The operation name.
     * @param arguments  The call arguments.
     * @return The bound arguments; empty if the operation is unknown.
     */
    public List<BoundArgument> bindCall(String systemName, List<IrArgument> arguments) {
        Optional<OperationSignature> signature = find(systemName);
        if (signature.isEmpty()) return List.of();
        if (!ADD_CONTROLLER.equals(systemName) || arguments.isEmpty()) {
            return bind(signature.get(), arguments);
        }
        List<BoundArgument> out = new ArrayList<>(bind(signature.get(), arguments.subList(0, 1)));
        Optional<OperationSignature> controller = controllerNameOf(arguments).flatMap(this::findController);
        List<IrArgument> rest = arguments.subList(1, arguments.size());
        if (controller.isPresent()) {
            out.addAll(bind(controller.get(), rest));
        } else {
            for (IrArgument a : rest) out.add(new BoundArgument(null, a.name(), a.value()));
        }
        return out;
    }

    /**
     * @param arguments The arguments of an {@code addController} call.
     * @return The controller name, if the first argument is a string literal.
     */
    public static Optional<String> controllerNameOf(List<IrArgument> arguments) {
        if (!arguments.isEmpty() && arguments.get(0).value() instanceof IrValue.Str s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }

    /**
     * Matches arguments to the parameters of a signature. Positional arguments fill parameters in
     * order, skipping parameters already filled by keyword; keyword arguments match by name.
     *
     * @param signature The signature.
     * @param arguments The arguments.
     * @return One bound argument per input argument, in input order.
     */
    public static List<BoundArgument> bind(OperationSignature signature, List<IrArgument> arguments) {
        List<OperationParameter> params = signature.parameters();
        boolean[] filled = new boolean[params.size()];
        for (IrArgument a : arguments) {
            if (!a.isPositional()) {
                for (int i = 0; i < params.size(); i++) {
                    if (params.get(i).name().equals(a.name())) filled[i] = true;
                }
            }
        }
        List<BoundArgument> out = new ArrayList<>(arguments.size());
        int next = 0;
        for (IrArgument a : arguments) {
            if (a.isPositional()) {
                while (next < params.size() && filled[next]) next++;
                if (next < params.size()) {
                    OperationParameter p = params.get(next);
                    filled[next] = true;
                    out.add(new BoundArgument(p, p.name(), a.value()));
                } else {
                    out.add(new BoundArgument(null, null, a.value()));
                }
            } else {
                OperationParameter match = null;
                for (OperationParameter p : params) {
                    if (p.name().equals(a.name())) {
                        match = p;
                        break;
                    }
                }
                out.add(new BoundArgument(match, a.name(), a.value()));
            }
        }
        return out;
    }
}
