package org.cuepoint.compiler;

import org.cuepoint.compiler.api.CompilationException;
import org.cuepoint.compiler.api.CompilationResult;
import org.cuepoint.compiler.api.ICompiler;
import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.backend.emit.Emitter;
import org.cuepoint.compiler.backend.optimize.Optimizer;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.ast.Program;
import org.cuepoint.compiler.frontend.irgen.IrGenerator;
import org.cuepoint.compiler.frontend.semantics.ImportGraph;
import org.cuepoint.compiler.frontend.semantics.Validator;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.registry.Registries;
import org.cuepoint.compiler.registry.RegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main compiler implementation. Orchestrates the pipeline from a parsed document to the
 * runtime configuration:
 * <ol>
 *   <li>Lowering of the syntax tree to IR</li>
 *   <li>Validation of the IR against the document's imports and the registries</li>
 *   <li>Optimization</li>
 *   <li>Emission of the JSON configuration</li>
 * </ol>
 * Diagnostics never stop the pipeline; only a {@link CompilationException} does.
 * Instances hold no per-compilation state and may be shared.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final IrGenerator irGenerator;
    private final Validator validator;
    private final Optimizer optimizer;
    private final Emitter emitter;
    private final Registries registries;
    private final RegistryLoader registryLoader;

    /**
     * @param irGenerator    The lowering phase.
     * @param validator      The validation phase.
     * @param optimizer      The optimization phase.
     * @param emitter        The emission phase.
     * @param registries     The registries read during validation.
     * @param registryLoader The loader that fills the registries from a document's imports.
     */
    public Compiler(IrGenerator irGenerator, Validator validator, Optimizer optimizer, Emitter emitter,
                    Registries registries, RegistryLoader registryLoader) {
        this.irGenerator = irGenerator;
        this.validator = validator;
        this.optimizer = optimizer;
        this.emitter = emitter;
        this.registries = registries;
        this.registryLoader = registryLoader;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The registries are used as they are; call {@link #compile(Program, String)} to load the
     * document's stylesheets and labels first.
     */
    @Override
    public CompilationResult compile(Program program) throws CompilationException {
        return run(program, new DiagnosticsEngine());
    }

    /**
     * Loads the stylesheets and labels the document imports, then compiles it. Load failures
     * are reported as diagnostics of the result.
     *
     * @param program      The syntax tree of the document.
     * @param documentPath The file system path of the document, used to resolve imports.
     * @return The compilation result.
     * @throws CompilationException if the tree cannot be lowered or the IR cannot be emitted.
     */
    public CompilationResult compile(Program program, String documentPath) throws CompilationException {
        if (program == null) {
            throw new TransformException("No program to lower");
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.addAll(registryLoader.loadDocument(program.documentUri(), documentPath, ImportGraph.from(program)));
        return run(program, diagnostics);
    }

    /**
     * @return The loader that maintains the registries used by this compiler.
     */
    public RegistryLoader registryLoader() {
        return registryLoader;
    }

    private CompilationResult run(Program program, DiagnosticsEngine diagnostics) throws CompilationException {
        // Phase 1: Lowering
        IrDocument lowered = irGenerator.generate(program);

        // Phase 2: Validation
        diagnostics.addAll(validator.validate(lowered, ImportGraph.from(program), registries));

        // Phase 3: Optimization
        IrDocument optimized = optimizer.optimize(lowered);

        // Phase 4: Emission
        String json = emitter.emit(optimized);

        LOG.info("Compiled {}: {} timeline(s), {} error(s), {} warning(s)",
                program.documentUri(), optimized.timelines().size(),
                diagnostics.errors().size(), diagnostics.warnings().size());
        return new CompilationResult(lowered, optimized, diagnostics.getDiagnostics(), json);
    }
}
