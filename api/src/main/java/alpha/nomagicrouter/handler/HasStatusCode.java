package alpha.nomagicrouter.handler;

import alpha.nomagicrouter.message.ApplicationException;

/**
 * Adds {@link #statusCode()} to an exception.<p>
 * 
 * An exception implementing this interface is considered intentionally
 * client-facing. If it propagates to the response pipeline, the client gets a
 * response with the exception's status code and the exception's message as
 * body. Exceptions not implementing this interface are logged and the client
 * gets a 500 (Internal Server Error) with a generic message.<p>
 * 
 * This interface is intended to be implemented by exception classes only. The
 * usual base class is {@link ApplicationException}.
 */
public interface HasStatusCode
{
    /**
     * {@return the status code to respond}
     */
    int statusCode();
    
    /**
     * {@return the message to respond}
     * 
     * Exception classes inherit this method from {@link Throwable}.
     */
    String getMessage();
}
