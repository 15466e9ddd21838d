package org.spacompose.module;

import org.spacompose.config.SpaSettings;
import org.spacompose.diagnostics.DiagnosticsEngine;
import org.spacompose.network.IProbeData;
import org.spacompose.network.Network;
import org.spacompose.network.NetworkContext;
import org.spacompose.params.IntParam;
import org.spacompose.params.Param;
import org.spacompose.params.ParamDefaults;
import org.spacompose.params.SynapseParam;
import org.spacompose.vocab.ISimilarityFunction;
import org.spacompose.vocab.Vocabulary;
import org.spacompose.vocab.VocabularyMap;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * A network with named input and output ports, each bound to a vocabulary or to the
 * dimensionality of the vocabulary it wants.
 * <p>
 * Submodules are named with {@link #assign(String, Object)} (or {@link #add(String, Module)}):
 * the name becomes the address under which ports are reached, e.g. {@code "vision.default"} or
 * {@code "vision"}. A module created inside another module's scope must be named before that
 * scope closes.
 *
 * <pre>
 * Module model = new Module("model");
 * model.build(() -&gt; {
 *     model.add("vision", new Buffer(null, 64));
 *     model.add("memory", new Buffer(null, 64));
 *     model.add("link", new Route(null, "vision", "memory"));
 * });
 * Vocabulary v = model.getOutputVocabulary("vision");
 * </pre>
 *
 * <p>Modules created inside another module's scope without an explicit {@link VocabularyMap}
 * share the enclosing module's map, parameter defaults, registrar and diagnostics.</p>
 */
public class Module extends Network {

    public static final IntParam DIM_PER_ENSEMBLE = new IntParam("dimPerEnsemble", 16, 1);
    public static final IntParam PRODUCT_NEURONS = new IntParam("productNeurons", 100, 1);
    public static final IntParam CCONV_NEURONS = new IntParam("cconvNeurons", 200, 1);
    public static final SynapseParam SYNAPSE = new SynapseParam("synapse", 0.01);

    private static final List<Param<?>> PARAMS = List.of(DIM_PER_ENSEMBLE, PRODUCT_NEURONS, CCONV_NEURONS, SYNAPSE);

    private final VocabularyMap vocabs;
    private final ParamDefaults paramDefaults;
    private final ModuleRegistrar registrar;
    private final DiagnosticsEngine diagnostics;
    private final ModuleNameResolver resolver;

    private final Map<String, Module> children = new LinkedHashMap<>();
    private final Map<String, Port> inputs = new LinkedHashMap<>();
    private final Map<String, Port> outputs = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<Param<?>, Object> paramValues = new HashMap<>();
    private Module parent;

    /**
     * Creates a module nested in the innermost open scope, if any.
     *
     * @param label The label, or {@code null} to take the name it is registered under.
     */
    public Module(String label) {
        this(label, null, null, null);
    }

    /**
     * @param label          The label, or {@code null} to take the name it is registered under.
     * @param seed           Seeds the vocabulary map created for this module, or {@code null}.
     * @param addToContainer See {@link Network#Network(String, Long, Boolean)}.
     * @param vocabs         The vocabulary map to use, or {@code null} to share the enclosing
     *                       module's map or create a new one.
     */
    public Module(String label, Long seed, Boolean addToContainer, VocabularyMap vocabs) {
        this(label, seed, addToContainer, vocabs, null);
    }

    /**
     * @param label          The label, or {@code null} to take the name it is registered under.
     * @param seed           Seeds the vocabulary map created for this module, or {@code null}.
     * @param addToContainer See {@link Network#Network(String, Long, Boolean)}.
     * @param vocabs         The vocabulary map to use, or {@code null} to share the enclosing
     *                       module's map or create a new one.
     * @param settings       Settings for parameter defaults and error reporting, or {@code null} to
     *                       inherit from the enclosing module or use {@link SpaSettings#defaults()}.
     */
    public Module(String label, Long seed, Boolean addToContainer, VocabularyMap vocabs, SpaSettings settings) {
        super(label, seed, addToContainer);
        Optional<Module> enclosing = NetworkContext.innermost(Module.class);

        if (vocabs != null) {
            this.vocabs = vocabs;
        } else if (enclosing.isPresent()) {
            this.vocabs = enclosing.get().vocabs;
        } else {
            this.vocabs = new VocabularyMap(seed != null ? new Random(seed) : null);
        }

        if (settings == null && enclosing.isPresent()) {
            this.paramDefaults = enclosing.get().paramDefaults;
            this.registrar = enclosing.get().registrar;
            this.diagnostics = enclosing.get().diagnostics;
        } else {
            SpaSettings effective = settings != null ? settings : SpaSettings.defaults();
            this.paramDefaults = effective.paramDefaults();
            this.registrar = new ModuleRegistrar(effective.errorReportingPolicy());
            this.diagnostics = new DiagnosticsEngine();
        }
        this.resolver = new ModuleNameResolver(diagnostics);
    }

    /**
     * Called once this module has been registered in {@code parent}, after its ports were resolved.
     * Override to defer setup that needs the owning composition, such as connecting to siblings.
     *
     * @param parent The module this one was registered in.
     */
    protected void onAdd(Module parent) {
    }

    @Override
    protected void onExit(Throwable inFlight) {
        super.onExit(inFlight);
        if (inFlight != null) {
            return;
        }
        StructuralValidator.validate(this);
    }

    // === Naming ===

    /**
     * Binds a name within this module. See {@link ModuleRegistrar#assign(Module, String, Object)}.
     *
     * @param name  The attribute name.
     * @param value A submodule, {@link Param#DEFAULT}, a parameter value or any other attribute.
     */
    public void assign(String name, Object value) {
        registrar.assign(this, name, value);
    }

    /**
     * Registers a submodule and returns it.
     *
     * @param name   The submodule name.
     * @param module The submodule.
     * @param <M>    The submodule type.
     * @return {@code module}.
     */
    public <M extends Module> M add(String name, M module) {
        registrar.register(this, name, module);
        return module;
    }

    // === Ports ===

    public void addInput(String name, Object target, int dimensions) {
        inputs.put(name, new Port(target, VocabBinding.of(dimensions)));
    }

    public void addInput(String name, Object target, Vocabulary vocabulary) {
        inputs.put(name, new Port(target, VocabBinding.of(vocabulary)));
    }

    public void addOutput(String name, Object target, int dimensions) {
        outputs.put(name, new Port(target, VocabBinding.of(dimensions)));
    }

    public void addOutput(String name, Object target, Vocabulary vocabulary) {
        outputs.put(name, new Port(target, VocabBinding.of(vocabulary)));
    }

    public Map<String, Port> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public Map<String, Port> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    // === Resolution ===

    /**
     * @param path A dotted module path.
     * @return The module.
     * @throws ModuleNotFoundException if the path leads nowhere.
     */
    public Module getModule(String path) {
        return getModule(path, false);
    }

    /**
     * @param path        A dotted module path.
     * @param stripOutput If true, a final segment naming a port resolves to the module owning it.
     * @return The module.
     * @throws ModuleNotFoundException if the path leads nowhere.
     */
    public Module getModule(String path, boolean stripOutput) {
        return resolver.getModule(this, path, stripOutput);
    }

    /**
     * Returns the input to connect into. The path is a module name (its {@code "default"} input)
     * or {@code module.input}.
     *
     * @param path The input path.
     * @return The port.
     * @throws PortNotFoundException if the path leads nowhere.
     */
    public Port getModuleInput(String path) {
        return resolver.getPort(this, path, PortKind.INPUT);
    }

    /**
     * Returns the output to connect from. The path is a module name (its {@code "default"} output)
     * or {@code module.output}.
     *
     * @param path The output path.
     * @return The port.
     * @throws PortNotFoundException if the path leads nowhere.
     */
    public Port getModuleOutput(String path) {
        return resolver.getPort(this, path, PortKind.OUTPUT);
    }

    public Iterable<String> getModuleInputs() {
        return resolver.listPorts(this, PortKind.INPUT);
    }

    public Iterable<String> getModuleOutputs() {
        return resolver.listPorts(this, PortKind.OUTPUT);
    }

    public VocabBinding getInputVocab(String path) {
        return getModuleInput(path).binding();
    }

    public VocabBinding getOutputVocab(String path) {
        return getModuleOutput(path).binding();
    }

    /**
     * @param path The input path.
     * @return The vocabulary of the input.
     * @throws IllegalStateException if the input is not bound to a vocabulary yet.
     */
    public Vocabulary getInputVocabulary(String path) {
        return requireVocabulary(getInputVocab(path), path);
    }

    /**
     * @param path The output path.
     * @return The vocabulary of the output.
     * @throws IllegalStateException if the output is not bound to a vocabulary yet.
     */
    public Vocabulary getOutputVocabulary(String path) {
        return requireVocabulary(getOutputVocab(path), path);
    }

    private static Vocabulary requireVocabulary(VocabBinding binding, String path) {
        return binding.vocabulary().orElseThrow(() -> new IllegalStateException(
                "Port '" + path + "' is not bound to a vocabulary yet (dimensions " + binding.dimensions() + ")."));
    }

    /**
     * Compares probed data with a vocabulary.
     *
     * @param data       The recorded probe data.
     * @param probe      The probe whose rows are compared.
     * @param vocab      The vocabulary, or {@code null} to use this module's vocabulary of the
     *                   probe's width.
     * @param similarity The similarity measure.
     * @return The similarity rows.
     * @throws IllegalStateException if {@code vocab} is null and no vocabulary of the probe's width exists.
     */
    public double[][] similarity(IProbeData data, Object probe, Vocabulary vocab, ISimilarityFunction similarity) {
        double[][] rows = data.get(probe);
        if (vocab == null) {
            int width = rows.length > 0 ? rows[0].length : data.dimensions(probe);
            vocab = vocabs.get(width).orElseThrow(() -> new IllegalStateException(
                    "No vocabulary of dimension " + width + " in " + this + "."));
        }
        return similarity.similarity(rows, vocab);
    }

    // === Parameters and attributes ===

    /**
     * @return The parameters this module type declares. Subclasses may extend the list.
     */
    protected List<Param<?>> declaredParams() {
        return PARAMS;
    }

    Optional<Param<?>> findParam(String name) {
        return declaredParams().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * @param param A declared parameter.
     * @param <T>   The value type.
     * @return The value written for it, or the configured default.
     */
    public <T> T get(Param<T> param) {
        Object value = paramValues.get(param);
        if (value == null) {
            return param.validate(toString(), paramDefaults.lookup(getClass(), param));
        }
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return typed;
    }

    public int getDimPerEnsemble() {
        return get(DIM_PER_ENSEMBLE);
    }

    public int getProductNeurons() {
        return get(PRODUCT_NEURONS);
    }

    public int getCconvNeurons() {
        return get(CCONV_NEURONS);
    }

    public double getSynapse() {
        return get(SYNAPSE);
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    // === Structure ===

    public VocabularyMap getVocabs() {
        return vocabs;
    }

    public ParamDefaults getParamDefaults() {
        return paramDefaults;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The registered submodules in registration order.
     */
    public Map<String, Module> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public Optional<Module> getChild(String name) {
        return Optional.ofNullable(children.get(name));
    }

    /**
     * @return The module this one is registered in, or empty while unregistered.
     */
    public Optional<Module> getParent() {
        return Optional.ofNullable(parent);
    }

    void setParent(Module parent) {
        this.parent = parent;
    }

    Map<String, Module> childMap() {
        return children;
    }

    Map<String, Port> inputMap() {
        return inputs;
    }

    Map<String, Port> outputMap() {
        return outputs;
    }

    Map<String, Object> attributeMap() {
        return attributes;
    }

    Map<Param<?>, Object> paramValueMap() {
        return paramValues;
    }
}
