package alpha.nomagicrouter.handler;

import alpha.nomagicrouter.message.Request;
import alpha.nomagicrouter.message.Response;
import alpha.nomagicrouter.message.Responses;
import alpha.nomagicrouter.route.Router;

import java.util.concurrent.CompletionStage;

/**
 * Processes a request into a response.<p>
 * 
 * The handler may return anything. The server's response pipeline normalizes
 * the returned value into a response:
 * 
 * <ul>
 *   <li>a {@link Response} is used as-is (see {@link Responses#reply(Object, int)})</li>
 *   <li>a {@link CompletionStage} is awaited, and its result is normalized</li>
 *   <li>{@link #HANDLED} means the handler wrote the response itself using
 *       the given {@link ChannelWriter}; nothing more is written</li>
 *   <li>any other value, including {@code null}, becomes the body of a
 *       200 (OK) response</li>
 * </ul>
 * 
 * A body is written as-is if it is text, with an
 * {@code application/octet-stream} content type if it is binary or a stream,
 * and serialized to JSON if it is any other object or a number.<p>
 * 
 * An exception thrown by the handler (or by the returned stage) that
 * implements {@link HasStatusCode} is translated to a response with the
 * exception's status code and message. Any other exception is logged and
 * translated to a 500 (Internal Server Error) with a generic message.<p>
 * 
 * A {@link Router} is itself a handler.
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Sentinel return value signalling that the handler has written the
     * response through the channel itself.
     */
    Object HANDLED = new Object() {
        @Override
        public String toString() {
            return "HANDLED";
        }
    };
    
    /**
     * Handles a request.
     * 
     * @param request the request
     * @param channel for writing a response directly (rarely needed)
     * 
     * @return the response, or its body, or a stage thereof, or {@link #HANDLED}
     * 
     * @throws Exception if the handler fails
     */
    Object apply(Request request, ChannelWriter channel) throws Exception;
}
