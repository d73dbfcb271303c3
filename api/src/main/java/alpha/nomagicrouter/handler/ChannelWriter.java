package alpha.nomagicrouter.handler;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Writes the response of an exchange to the client.<p>
 * 
 * The status code and headers are buffered until one of the terminating
 * methods {@link #end()}, {@link #end(byte[])} or {@link #pipe(InputStream)}
 * is called. Only one terminating method may be called per exchange.<p>
 * 
 * Header names are case-insensitive.<p>
 * 
 * A handler rarely needs the channel. If it does write the response itself,
 * it should return {@link Handler#HANDLED}.
 */
public interface ChannelWriter
{
    /**
     * Returns the status code that will be written.<p>
     * 
     * Defaults to 200.
     * 
     * @return the status code that will be written
     */
    int statusCode();
    
    /**
     * Sets the status code to write.
     * 
     * @param statusCode to write
     * 
     * @throws IllegalStateException if the channel is committed
     */
    void statusCode(int statusCode);
    
    /**
     * Returns the header value, if set.
     * 
     * @param name of header
     * @return the header value, if set
     */
    Optional<String> getHeader(String name);
    
    /**
     * Returns {@code true} if the header has been set.
     * 
     * @param name of header
     * @return {@code true} if the header has been set
     */
    default boolean hasHeader(String name) {
        return getHeader(name).isPresent();
    }
    
    /**
     * Sets a header, replacing any previous value.
     * 
     * @param name of header
     * @param value of header
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if the channel is committed
     */
    void setHeader(String name, String value);
    
    /**
     * Writes the status line and headers, without a body.
     * 
     * @throws IOException on I/O error
     * @throws IllegalStateException if the channel is committed
     */
    void end() throws IOException;
    
    /**
     * Writes the status line, headers and the given body.
     * 
     * @param body to write
     * 
     * @throws IOException on I/O error
     * @throws IllegalStateException if the channel is committed
     */
    void end(byte[] body) throws IOException;
    
    /**
     * Writes the status line and headers, then transfers all bytes from the
     * given stream until end of stream, and closes the stream.<p>
     * 
     * The length of the body is not known up front, so no Content-Length
     * header is written.
     * 
     * @param body to transfer
     * 
     * @throws IOException on I/O error
     * @throws IllegalStateException if the channel is committed
     */
    void pipe(InputStream body) throws IOException;
    
    /**
     * Returns {@code true} if a terminating method has been called.
     * 
     * @return {@code true} if a terminating method has been called
     */
    boolean isCommitted();
}
