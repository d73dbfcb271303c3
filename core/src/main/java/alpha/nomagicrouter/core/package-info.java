/**
 * Home of the library-provided server implementation.<p>
 * 
 * The public types in this package are {@link
 * alpha.nomagicrouter.core.DefaultServer}, used by the {@link
 * alpha.nomagicrouter.HttpServer} interface as the default implementation,
 * {@link alpha.nomagicrouter.core.Dispatcher}, which can be used to embed the
 * response pipeline in another server, and {@link
 * alpha.nomagicrouter.core.JacksonCodec}. All other types in this package can
 * be regarded as an implementation detail.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.nomagicrouter.core;
