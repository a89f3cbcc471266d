package org.cuepoint.compiler.config;

import com.typesafe.config.Config;
import org.cuepoint.compiler.Compiler;
import org.cuepoint.compiler.assets.IAssetLoader;
import org.cuepoint.compiler.backend.emit.Emitter;
import org.cuepoint.compiler.backend.emit.EmitterOptions;
import org.cuepoint.compiler.backend.optimize.Optimizer;
import org.cuepoint.compiler.frontend.irgen.IrGenerator;
import org.cuepoint.compiler.frontend.semantics.Validator;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.cuepoint.compiler.registry.Registries;
import org.cuepoint.compiler.registry.RegistryLoader;

/**
 * Wires a {@link Compiler} from configuration.
 */
public final class CompilerFactory {

    static final String EMITTER_PATH = "compiler.emitter";
    static final String SUGGESTION_DISTANCE_PATH = "compiler.validation.suggestion-max-distance";

    private CompilerFactory() {
    }

    /**
     * Configures logging and builds a compiler with the default phases.
     *
     * @param config     The resolved configuration; see {@code reference.conf} for the keys.
     * @param registries The registries shared by validation and loading.
     * @param assets     The loader for imported files.
     * @return The compiler.
     */
    public static Compiler create(Config config, Registries registries, IAssetLoader assets) {
        LoggingConfigurator.configure(config);
        OperationCatalog catalog = OperationCatalog.loadDefault();
        return new Compiler(
                new IrGenerator(),
                new Validator(catalog, config.getInt(SUGGESTION_DISTANCE_PATH)),
                new Optimizer(),
                new Emitter(catalog, emitterOptions(config)),
                registries,
                new RegistryLoader(registries, assets));
    }

    /**
     * @param config The resolved configuration.
     * @return The emitter settings under {@code compiler.emitter}.
     */
    public static EmitterOptions emitterOptions(Config config) {
        Config emitter = config.getConfig(EMITTER_PATH);
        return new EmitterOptions(
                emitter.getString("schema-url"),
                emitter.getString("engine-system-name"),
                emitter.getString("default-container-selector"),
                emitter.getString("default-language"),
                emitter.getString("default-layout-template"),
                emitter.getBoolean("pretty-print"));
    }
}
