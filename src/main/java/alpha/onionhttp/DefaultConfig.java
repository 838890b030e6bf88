package alpha.onionhttp;

import alpha.onionhttp.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final boolean redirectTrailingSlash,
                          handleMethodNotAllowed,
                          trustForwardedFor;
    private final int     maxPooledContexts;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                = b;
        redirectTrailingSlash  = s.redirectTrailingSlash;
        handleMethodNotAllowed = s.handleMethodNotAllowed;
        trustForwardedFor      = s.trustForwardedFor;
        maxPooledContexts      = s.maxPooledContexts;
    }
    
    @Override
    public boolean redirectTrailingSlash() {
        return redirectTrailingSlash;
    }
    
    @Override
    public boolean handleMethodNotAllowed() {
        return handleMethodNotAllowed;
    }
    
    @Override
    public int maxPooledContexts() {
        return maxPooledContexts;
    }
    
    @Override
    public boolean trustForwardedFor() {
        return trustForwardedFor;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "redirectTrailingSlash=" + redirectTrailingSlash +
                ", handleMethodNotAllowed=" + handleMethodNotAllowed +
                ", maxPooledContexts=" + maxPooledContexts +
                ", trustForwardedFor=" + trustForwardedFor + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            boolean redirectTrailingSlash  = false,
                    handleMethodNotAllowed = false,
                    trustForwardedFor      = false;
            int     maxPooledContexts      = 1_024;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder redirectTrailingSlash(boolean newVal) {
            return new DefaultBuilder(this, s -> s.redirectTrailingSlash = newVal);
        }
        
        @Override
        public Builder handleMethodNotAllowed(boolean newVal) {
            return new DefaultBuilder(this, s -> s.handleMethodNotAllowed = newVal);
        }
        
        @Override
        public Builder maxPooledContexts(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative pool size: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.maxPooledContexts = newVal);
        }
        
        @Override
        public Builder trustForwardedFor(boolean newVal) {
            return new DefaultBuilder(this, s -> s.trustForwardedFor = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
