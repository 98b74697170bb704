package io.quantum.core.engine;

import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.ExecutionBudgetExceededException;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.FlashMessage;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.spi.EvaluationScope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Per-request execution state: the scope stack, the output buffer, collected flash messages and
 * the budget counters. One instance serves exactly one request on one thread; only the
 * application and session {@link ScopeStore}s it references are shared.
 *
 * <p>Frames, outer to inner: Application, Session, Request, Component, Local*. Each component call
 * pushes a Component frame with its own Local stack; each loop iteration and function call pushes
 * a Local frame.
 *
 * <p>Resolution rules:
 * <ul>
 * <li>A {@code local.}, {@code component.}, {@code request.}, {@code session.} or
 * {@code application.} prefix addresses that scope directly, for reads and writes.</li>
 * <li>An unqualified read searches Local frames innermost first (stopping at the frame of the
 * enclosing function call), then the Component frame, then Request. It never reaches Session or
 * Application.</li>
 * <li>An unqualified write overwrites the nearest existing binding among those same frames, and
 * otherwise creates the name in the innermost Local frame (the Component frame when no Local frame
 * is open).</li>
 * </ul>
 */
public final class ExecutionContext implements EvaluationScope {

    /** Marker returned by {@link #resolve(String)} for a name with no binding. */
    public static final Object UNDEFINED = new Object() {
        @Override
        public String toString() {
            return "undefined";
        }
    };

    private final Scopes scopes;
    private final Map<String, Object> request;
    private final ExecutionBudget budget;
    private final ExpressionEvaluator evaluator;
    private final ExecutorRegistry executors;
    private final Collaborators collaborators;

    private final Deque<ComponentFrame> components = new ArrayDeque<>();
    private final Deque<List<String>> outputs = new ArrayDeque<>();
    private final List<FlashMessage> flashMessages = new ArrayList<>();
    private final long startNanos = System.nanoTime();

    private long steps;
    private int callDepth;
    private volatile boolean cancelled;
    private SourceLocation currentLocation = SourceLocation.UNKNOWN;

    public ExecutionContext(
            Scopes scopes,
            ExecutionBudget budget,
            ExpressionEvaluator evaluator,
            ExecutorRegistry executors,
            Collaborators collaborators) {
        this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
        this.request = new HashMap<>(scopes.request());
        this.outputs.push(new ArrayList<>());
    }

    // --- Collaborators and services ---

    public Scopes scopes() {
        return scopes;
    }

    public ExecutionBudget budget() {
        return budget;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public Collaborators collaborators() {
        return collaborators;
    }

    // --- Resolution ---

    /**
     * Resolves a dotted name under the rules in the class description.
     *
     * @return the bound value (possibly {@code null}), or {@link #UNDEFINED}
     */
    public Object resolve(String name) {
        Objects.requireNonNull(name, "name must not be null");
        int dot = name.indexOf('.');
        String root = dot < 0 ? name : name.substring(0, dot);
        String rest = dot < 0 ? null : name.substring(dot + 1);
        ScopeLevel level = ScopeLevel.fromPrefix(root);
        if (level == null) {
            return navigate(readUnqualified(root), rest);
        }
        if (rest == null) {
            return scopeView(level);
        }
        int next = rest.indexOf('.');
        String key = next < 0 ? rest : rest.substring(0, next);
        String remainder = next < 0 ? null : rest.substring(next + 1);
        return navigate(readScope(level, key), remainder);
    }

    @Override
    public Object lookup(String path) {
        Object value = resolve(path);
        return value == UNDEFINED ? null : value;
    }

    @Override
    public boolean isDefined(String path) {
        return resolve(path) != UNDEFINED;
    }

    /** The scope a name targets explicitly through its prefix, or {@code null} for an unqualified name. */
    public static ScopeLevel explicitScope(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? null : ScopeLevel.fromPrefix(name.substring(0, dot));
    }

    private Object readUnqualified(String root) {
        Map<String, Object> holder = holderOf(root);
        return holder != null ? holder.get(root) : UNDEFINED;
    }

    private Map<String, Object> holderOf(String root) {
        ComponentFrame frame = components.peek();
        if (frame != null) {
            for (LocalFrame local : frame.locals) {
                if (local.vars.containsKey(root)) {
                    return local.vars;
                }
                if (local.boundary) {
                    break;
                }
            }
            if (frame.vars.containsKey(root)) {
                return frame.vars;
            }
        }
        return request.containsKey(root) ? request : null;
    }

    private Object readScope(ScopeLevel level, String key) {
        return switch (level) {
            case LOCAL -> readLocal(key);
            case COMPONENT -> {
                ComponentFrame frame = components.peek();
                yield frame != null && frame.vars.containsKey(key) ? frame.vars.get(key) : UNDEFINED;
            }
            case REQUEST -> request.containsKey(key) ? request.get(key) : UNDEFINED;
            case SESSION -> scopes.session().containsKey(key) ? scopes.session().get(key) : UNDEFINED;
            case APPLICATION -> scopes.application().containsKey(key) ? scopes.application().get(key) : UNDEFINED;
        };
    }

    private Object readLocal(String key) {
        ComponentFrame frame = components.peek();
        if (frame != null) {
            for (LocalFrame local : frame.locals) {
                if (local.vars.containsKey(key)) {
                    return local.vars.get(key);
                }
                if (local.boundary) {
                    break;
                }
            }
        }
        return UNDEFINED;
    }

    private Map<String, Object> scopeView(ScopeLevel level) {
        return switch (level) {
            case LOCAL -> visibleLocals();
            case COMPONENT -> {
                ComponentFrame frame = components.peek();
                yield frame != null ? Collections.unmodifiableMap(frame.vars) : Map.of();
            }
            case REQUEST -> Collections.unmodifiableMap(request);
            case SESSION -> scopes.session().snapshot();
            case APPLICATION -> scopes.application().snapshot();
        };
    }

    private Map<String, Object> visibleLocals() {
        Map<String, Object> merged = new LinkedHashMap<>();
        ComponentFrame frame = components.peek();
        if (frame != null) {
            List<LocalFrame> visible = new ArrayList<>();
            for (LocalFrame local : frame.locals) {
                visible.add(local);
                if (local.boundary) {
                    break;
                }
            }
            Collections.reverse(visible);
            visible.forEach(local -> merged.putAll(local.vars));
        }
        return Collections.unmodifiableMap(merged);
    }

    private static Object navigate(Object base, String path) {
        if (path == null || base == UNDEFINED) {
            return base;
        }
        Object current = base;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    return UNDEFINED;
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int index = Integer.parseInt(segment);
                if (index >= list.size()) {
                    return UNDEFINED;
                }
                current = list.get(index);
            } else {
                Object value = Values.member(current, segment);
                if (value == null) {
                    return UNDEFINED;
                }
                current = value;
            }
        }
        return current;
    }

    // --- Assignment ---

    /**
     * Binds a dotted name under the rules in the class description. A write below the root
     * ({@code user.name}) binds a copy of the root value with the change applied, creating maps
     * along the way; the previous structure is never modified, whichever frame or store it is also
     * bound in. Writes into the application or session store happen under the store's lock.
     *
     * @throws IllegalArgumentException when assigning to a bare scope name such as {@code session}
     */
    public void assign(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        int dot = name.indexOf('.');
        String root = dot < 0 ? name : name.substring(0, dot);
        String rest = dot < 0 ? null : name.substring(dot + 1);
        ScopeLevel level = ScopeLevel.fromPrefix(root);
        if (level == null) {
            Map<String, Object> holder = holderOf(root);
            write(holder != null ? holder : defaultWriteTarget(), root, rest, value);
            return;
        }
        if (rest == null || rest.isEmpty()) {
            throw new IllegalArgumentException("cannot assign to the whole '" + root + "' scope");
        }
        int next = rest.indexOf('.');
        String key = next < 0 ? rest : rest.substring(0, next);
        String remainder = next < 0 ? null : rest.substring(next + 1);
        switch (level) {
            case LOCAL -> write(innermostLocal(), key, remainder, value);
            case COMPONENT -> write(componentVars(), key, remainder, value);
            case REQUEST -> write(request, key, remainder, value);
            case SESSION -> writeShared(scopes.session(), key, remainder, value);
            case APPLICATION -> writeShared(scopes.application(), key, remainder, value);
        }
    }

    /** Removes a binding. Unqualified names are removed from the frame that holds them. */
    public void unset(String name) {
        ScopeLevel level = explicitScope(name);
        if (level == null) {
            Map<String, Object> holder = holderOf(name);
            if (holder != null) {
                holder.remove(name);
            }
            return;
        }
        String key = name.substring(name.indexOf('.') + 1);
        switch (level) {
            case SESSION -> scopes.session().remove(key);
            case APPLICATION -> scopes.application().remove(key);
            case REQUEST -> request.remove(key);
            case COMPONENT -> componentVars().remove(key);
            case LOCAL -> innermostLocal().remove(key);
        }
    }

    /**
     * Runs {@code action} under the lock of the shared store that {@code name} targets, so a
     * read-modify-write of an application or session variable is atomic. For every other name the
     * action simply runs.
     *
     * <p>The action may call user functions that write the other shared scope, so locks are always
     * taken in one order: the application lock first, then the session lock. A session target
     * therefore holds both.
     */
    public <T> T atomically(String name, Supplier<T> action) {
        ScopeLevel level = explicitScope(name);
        if (level == ScopeLevel.APPLICATION) {
            return scopes.application().locked(action);
        }
        if (level == ScopeLevel.SESSION) {
            return scopes.application().locked(() -> scopes.session().locked(action));
        }
        return action.get();
    }

    /**
     * Atomically replaces the value bound to {@code name} with {@code fn} applied to the current
     * value ({@code null} when undefined).
     *
     * @return the new value
     */
    public Object update(String name, UnaryOperator<Object> fn) {
        return atomically(name, () -> {
            Object updated = fn.apply(lookup(name));
            assign(name, updated);
            return updated;
        });
    }

    private Map<String, Object> defaultWriteTarget() {
        ComponentFrame frame = components.peek();
        if (frame == null) {
            return request;
        }
        LocalFrame local = frame.locals.peek();
        return local != null ? local.vars : frame.vars;
    }

    private Map<String, Object> innermostLocal() {
        return defaultWriteTarget();
    }

    private Map<String, Object> componentVars() {
        ComponentFrame frame = components.peek();
        return frame != null ? frame.vars : request;
    }

    private static void write(Map<String, Object> holder, String key, String path, Object value) {
        holder.put(key, path == null ? value : withPath(holder.get(key), path.split("\\."), 0, value));
    }

    private static void writeShared(ScopeStore store, String key, String path, Object value) {
        store.locked(() -> {
            store.put(key, path == null ? value : withPath(store.get(key), path.split("\\."), 0, value));
            return null;
        });
    }

    /**
     * Copies the containers along {@code segments} and sets {@code value} at the end. Containers off
     * the path are shared with the original, which is left as it was. A missing or scalar step
     * becomes a new map.
     */
    private static Object withPath(Object node, String[] segments, int at, Object value) {
        if (at == segments.length) {
            return value;
        }
        String segment = segments[at];
        if (node instanceof List<?> list) {
            int index = requireIndex(segment);
            List<Object> copy = new ArrayList<>(list);
            if (index < copy.size()) {
                copy.set(index, withPath(copy.get(index), segments, at + 1, value));
            } else if (index == copy.size()) {
                copy.add(withPath(null, segments, at + 1, value));
            } else {
                throw new IllegalArgumentException("index " + index + " is past the end of a list of " + list.size());
            }
            return copy;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (node instanceof Map<?, ?> map) {
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        }
        copy.put(segment, withPath(copy.get(segment), segments, at + 1, value));
        return copy;
    }

    private static int requireIndex(String segment) {
        if (!isIndex(segment)) {
            throw new IllegalArgumentException("'" + segment + "' is not a list index");
        }
        return Integer.parseInt(segment);
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // --- Frames ---

    /**
     * Enters a component: pushes a Component frame with an empty Local stack, seeded with the
     * unit's hoisted functions.
     *
     * @param slotContent rendered caller content for the unit's slot, or {@code null} for none
     * @throws NodeExecutionException when the call depth limit is reached
     */
    public void enterComponent(SourceUnit unit, String slotContent) {
        Objects.requireNonNull(unit, "unit must not be null");
        enterCall("component '" + unit.name() + "'");
        components.push(new ComponentFrame(unit, slotContent));
    }

    public void exitComponent() {
        if (components.isEmpty()) {
            throw new IllegalStateException("no component frame to exit");
        }
        components.pop();
        callDepth--;
    }

    /**
     * Enters a function call: pushes a Local frame that hides the caller's Local frames.
     *
     * @throws NodeExecutionException when the call depth limit is reached
     */
    public Map<String, Object> enterFunction(FunctionNode function) {
        enterCall("function '" + function.name() + "'");
        LocalFrame frame = new LocalFrame(true);
        requireComponent().locals.push(frame);
        return frame.vars;
    }

    /** Leaves a function call, discarding every Local frame it opened. */
    public void exitFunction() {
        Deque<LocalFrame> locals = requireComponent().locals;
        while (!locals.isEmpty()) {
            if (locals.pop().boundary) {
                break;
            }
        }
        callDepth--;
    }

    /** Opens a Local frame (one loop iteration, one block) and returns its bindings. */
    public Map<String, Object> pushLocal() {
        LocalFrame frame = new LocalFrame(false);
        requireComponent().locals.push(frame);
        return frame.vars;
    }

    public void popLocal() {
        Deque<LocalFrame> locals = requireComponent().locals;
        if (locals.isEmpty() || locals.peek().boundary) {
            throw new IllegalStateException("no block frame to pop");
        }
        locals.pop();
    }

    /** Binds a name in the innermost Local frame without consulting outer frames. */
    public void declareLocal(String name, Object value) {
        innermostLocal().put(name, value);
    }

    private void enterCall(String what) {
        if (callDepth >= budget.maxCallDepth()) {
            throw new NodeExecutionException(
                    "Maximum call depth of " + budget.maxCallDepth() + " exceeded calling " + what,
                    currentLocation,
                    componentName());
        }
        callDepth++;
    }

    public int callDepth() {
        return callDepth;
    }

    private ComponentFrame requireComponent() {
        ComponentFrame frame = components.peek();
        if (frame == null) {
            throw new IllegalStateException("no component is executing");
        }
        return frame;
    }

    /** The component currently executing, or {@code null} before one is entered. */
    public SourceUnit currentUnit() {
        ComponentFrame frame = components.peek();
        return frame != null ? frame.unit : null;
    }

    public String componentName() {
        SourceUnit unit = currentUnit();
        return unit != null ? unit.name() : null;
    }

    // --- Functions, imports and slots ---

    public void defineFunction(FunctionNode function) {
        requireComponent().functions.put(function.name(), function);
    }

    public Optional<FunctionNode> function(String name) {
        ComponentFrame frame = components.peek();
        return frame != null ? Optional.ofNullable(frame.functions.get(name)) : Optional.empty();
    }

    @Override
    public boolean hasFunction(String name) {
        return function(name).isPresent();
    }

    @Override
    public Object invokeFunction(String name, List<Object> arguments) {
        FunctionNode function = function(name)
                .orElseThrow(() -> new NodeExecutionException(
                        "Unknown function '" + name + "'", currentLocation, componentName()));
        return FunctionInvoker.invokePositional(function, arguments, this);
    }

    @Override
    public long maxGeneratedItems() {
        return budget.maxLoopIterations();
    }

    public void registerImport(String name, SourceUnit unit) {
        requireComponent().imports.put(name, unit);
    }

    public Optional<SourceUnit> importedComponent(String name) {
        ComponentFrame frame = components.peek();
        return frame != null ? Optional.ofNullable(frame.imports.get(name)) : Optional.empty();
    }

    /** Caller content passed to the current component, if any. */
    public Optional<String> slotContent() {
        ComponentFrame frame = components.peek();
        return frame != null ? Optional.ofNullable(frame.slotContent) : Optional.empty();
    }

    // --- Output and signals ---

    /** Appends a fragment to the current output. Empty fragments are dropped. */
    public void emit(String fragment) {
        if (fragment != null && !fragment.isEmpty()) {
            outputs.peek().add(fragment);
        }
    }

    /** Redirects output into a fresh buffer until {@link #endCapture()}. */
    public void beginCapture() {
        outputs.push(new ArrayList<>());
    }

    /** Ends a capture and returns what was emitted into it. */
    public String endCapture() {
        if (outputs.size() <= 1) {
            throw new IllegalStateException("no capture in progress");
        }
        return String.join("", outputs.pop());
    }

    /** Fragments emitted to the top-level output so far. */
    public List<String> fragments() {
        return List.copyOf(outputs.peekLast());
    }

    public void addFlash(FlashMessage message) {
        flashMessages.add(message);
    }

    public List<FlashMessage> flashMessages() {
        return List.copyOf(flashMessages);
    }

    // --- Budget ---

    /**
     * Counts one statement or loop iteration and checks the budget and the cancel flag.
     *
     * @throws ExecutionBudgetExceededException when a limit is exceeded or the execution was cancelled
     */
    public void step() {
        steps++;
        if (cancelled) {
            throw new ExecutionBudgetExceededException("Execution cancelled", currentLocation, componentName());
        }
        if (steps > budget.maxSteps()) {
            throw new ExecutionBudgetExceededException(
                    "Step budget of " + budget.maxSteps() + " exceeded", currentLocation, componentName());
        }
        long elapsedMs = elapsedMs();
        if (elapsedMs > budget.maxWallClockMs()) {
            throw new ExecutionBudgetExceededException(
                    "Wall-clock budget of " + budget.maxWallClockMs() + "ms exceeded after " + elapsedMs + "ms",
                    currentLocation,
                    componentName());
        }
    }

    /** Asks the execution to stop at its next statement boundary. Safe to call from any thread. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long steps() {
        return steps;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Location ---

    public SourceLocation currentLocation() {
        return currentLocation;
    }

    /** Sets the location of the node being executed and returns the previous one. */
    public SourceLocation enterLocation(SourceLocation location) {
        SourceLocation previous = currentLocation;
        currentLocation = location != null ? location : SourceLocation.UNKNOWN;
        return previous;
    }

    private static final class ComponentFrame {
        final SourceUnit unit;
        final String slotContent;
        final Map<String, Object> vars = new HashMap<>();
        final Deque<LocalFrame> locals = new ArrayDeque<>();
        final Map<String, FunctionNode> functions;
        final Map<String, SourceUnit> imports = new HashMap<>();

        ComponentFrame(SourceUnit unit, String slotContent) {
            this.unit = unit;
            this.slotContent = slotContent;
            this.functions = new HashMap<>(unit.functions());
        }
    }

    private static final class LocalFrame {
        final Map<String, Object> vars = new HashMap<>();
        final boolean boundary;

        LocalFrame(boolean boundary) {
            this.boundary = boundary;
        }
    }
}
