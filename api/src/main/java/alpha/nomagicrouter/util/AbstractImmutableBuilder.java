package alpha.nomagicrouter.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Abstract base class of an immutable builder.<p>
 * 
 * Each modifying method of the concrete builder returns a new builder which
 * links back to its predecessor together with the modification. Building
 * replays all modifications, oldest first, on a fresh mutable state object.
 * Builders can therefore be freely shared and used as templates.
 * 
 * @param <S> type of mutable state
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder (no modifications).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder deriving from a previous one.
     * 
     * @param prev builder
     * @param modifier of state
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a new state object with all modifications applied.
     * 
     * @param factory of initial state
     * @return the state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
