package alpha.nomagicrouter.util;

import alpha.nomagicrouter.message.Request;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * A request-scoped memoized value.<p>
 * 
 * A getter computes a value derived from a request at most once per request.
 * The first call for a request runs the compute function, and all subsequent
 * calls for the same request return the same value; reference-identical, not
 * merely equal.
 * 
 * <pre>
 *   static final Getter&lt;Void, User&gt; USER = Getter.create(req -&gt;
 *           users.lookup(Getters.URL_PARAMS.get(req).get("id")));
 *   
 *   router.get("/users/:id", (req, ch) -&gt; USER.get(req));
 * </pre>
 * 
 * The value is stored in {@link Request#getterValues()} and is discarded
 * together with the request. The getter object itself is the key, so a
 * getter is typically declared as a constant.<p>
 * 
 * A slot for the value is published before the compute function runs. A
 * concurrent call for the same request, made before the first computation
 * has returned, blocks until it has and then returns the same value (or
 * throws the same exception). Only one computation ever runs. If the compute
 * function returns a {@link CompletionStage}, then the stage itself is the
 * memoized value, and so an asynchronous computation is shared as well.<p>
 * 
 * If the compute function throws an exception, nothing is memoized, and the
 * next call will try again.<p>
 * 
 * The argument passed to {@link #get(Request, Object)} is only used by the
 * call that computes the value. It is not part of the key; a second call with
 * a different argument returns the memoized value.<p>
 * 
 * A compute function must not call its own getter for the same request; doing
 * so throws {@link IllegalStateException}.
 * 
 * @param <A> argument type ({@code Void} if not used)
 * @param <T> value type
 */
public final class Getter<A, T>
{
    /**
     * Computes a value from a request.
     * 
     * @param <T> value type
     */
    @FunctionalInterface
    public interface RequestFunction<T> {
        /**
         * Computes the value.
         * 
         * @param request the request
         * @return the value (may be {@code null})
         * @throws Exception of any kind
         */
        T apply(Request request) throws Exception;
    }
    
    /**
     * Computes a value from a request and an argument.
     * 
     * @param <A> argument type
     * @param <T> value type
     */
    @FunctionalInterface
    public interface RequestBiFunction<A, T> {
        /**
         * Computes the value.
         * 
         * @param request the request
         * @param arg argument (may be {@code null})
         * @return the value (may be {@code null})
         * @throws Exception of any kind
         */
        T apply(Request request, A arg) throws Exception;
    }
    
    /**
     * Creates a getter.
     * 
     * @param compute function
     * @param <T> value type
     * @return a new getter
     * @throws NullPointerException if {@code compute} is {@code null}
     */
    public static <T> Getter<Void, T> create(RequestFunction<T> compute) {
        requireNonNull(compute);
        return new Getter<>((req, ignored) -> compute.apply(req));
    }
    
    /**
     * Creates a getter whose compute function accepts an argument.
     * 
     * @param compute function
     * @param <A> argument type
     * @param <T> value type
     * @return a new getter
     * @throws NullPointerException if {@code compute} is {@code null}
     */
    public static <A, T> Getter<A, T> createWithArg(RequestBiFunction<A, T> compute) {
        return new Getter<>(requireNonNull(compute));
    }
    
    private final RequestBiFunction<A, T> compute;
    
    private Getter(RequestBiFunction<A, T> compute) {
        this.compute = compute;
    }
    
    /**
     * Returns the value for the given request.<p>
     * 
     * Same as {@code get(request, null)}.
     * 
     * @param request the request
     * @return the value
     * @throws NullPointerException if {@code request} is {@code null}
     * @throws Exception thrown by the compute function
     */
    public T get(Request request) throws Exception {
        return get(request, null);
    }
    
    /**
     * Returns the value for the given request.<p>
     * 
     * If the value has not yet been computed, the compute function is called
     * with the given argument.
     * 
     * @param request the request
     * @param arg passed to the compute function (may be {@code null})
     * @return the value
     * 
     * @throws NullPointerException
     *             if {@code request} is {@code null}
     * @throws IllegalStateException
     *             if called from the compute function for the same request
     * @throws InterruptedException
     *             if interrupted while waiting for a concurrent computation
     * @throws Exception
     *             thrown by the compute function
     */
    public T get(Request request, A arg) throws Exception {
        final var values = request.getterValues();
        Object slot = values.get(this);
        if (slot == null) {
            final var mine = new Slot<T>();
            slot = values.putIfAbsent(this, mine);
            if (slot == null) {
                return run(request, arg, mine);
            }
        }
        @SuppressWarnings("unchecked")
        CompletableFuture<T> typed = (CompletableFuture<T>) slot;
        return await(typed);
    }
    
    /**
     * Sets the value for the given request.<p>
     * 
     * Any previously memoized value is replaced. A computation in flight is
     * not affected, and the callers already waiting for it receive its
     * result.
     * 
     * @param request the request
     * @param value the value (may be {@code null})
     * @throws NullPointerException if {@code request} is {@code null}
     */
    public void set(Request request, T value) {
        request.getterValues().put(this, CompletableFuture.completedFuture(value));
    }
    
    private T run(Request request, A arg, Slot<T> slot) throws Exception {
        final T v;
        try {
            v = compute.apply(request, arg);
        } catch (Throwable t) {
            request.getterValues().remove(this, slot);
            slot.completeExceptionally(t);
            throw t;
        }
        slot.complete(v);
        return v;
    }
    
    private static <T> T await(CompletableFuture<T> slot) throws Exception {
        if (!slot.isDone() && slot instanceof Slot<T> mine &&
                mine.owner == Thread.currentThread()) {
            throw new IllegalStateException(
                    "Getter called recursively from its own compute function.");
        }
        try {
            return slot.get();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
    
    private static final class Slot<T> extends CompletableFuture<T> {
        final Thread owner = Thread.currentThread();
    }
}
