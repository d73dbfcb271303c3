package alpha.nomagicrouter;

import alpha.nomagicrouter.util.AbstractImmutableBuilder;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder  builder;
    private final long     bodyLimit;
    private final Charset  defaultCharset;
    private final int      workerThreads,
                           backlog;
    private final Duration stopGracePeriod;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder         = b;
        bodyLimit       = s.bodyLimit;
        defaultCharset  = s.defaultCharset;
        workerThreads   = s.workerThreads;
        backlog         = s.backlog;
        stopGracePeriod = s.stopGracePeriod;
    }
    
    @Override
    public long bodyLimit() {
        return bodyLimit;
    }
    
    @Override
    public Charset defaultCharset() {
        return defaultCharset;
    }
    
    @Override
    public int workerThreads() {
        return workerThreads;
    }
    
    @Override
    public int backlog() {
        return backlog;
    }
    
    @Override
    public Duration stopGracePeriod() {
        return stopGracePeriod;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "bodyLimit=" + bodyLimit +
                ", defaultCharset=" + defaultCharset +
                ", workerThreads=" + workerThreads +
                ", backlog=" + backlog +
                ", stopGracePeriod=" + stopGracePeriod + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            long     bodyLimit       = 1_048_576;
            Charset  defaultCharset  = UTF_8;
            int      workerThreads   = Math.max(2, Runtime.getRuntime().availableProcessors()),
                     backlog         = 0;
            Duration stopGracePeriod = ofSeconds(1);
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder bodyLimit(long newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative body limit: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.bodyLimit = newVal);
        }
        
        @Override
        public Builder defaultCharset(Charset newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.defaultCharset = newVal);
        }
        
        @Override
        public Builder workerThreads(int newVal) {
            if (newVal < 1) {
                throw new IllegalArgumentException("Need at least one worker thread, got: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.workerThreads = newVal);
        }
        
        @Override
        public Builder backlog(int newVal) {
            return new DefaultBuilder(this, s -> s.backlog = newVal);
        }
        
        @Override
        public Builder stopGracePeriod(Duration newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.stopGracePeriod = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
