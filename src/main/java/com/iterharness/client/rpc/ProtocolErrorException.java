package com.iterharness.client.rpc;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;

/**
 * Raised when the service answers a protocol call with a JSON-RPC error object.
 */
public class ProtocolErrorException extends HarnessException {

    private final String method;
    private final ProtocolError error;

    public ProtocolErrorException(String method, ProtocolError error) {
        super(ErrorKind.PROTOCOL_ERROR, method + " returned error " + error.code() + ": " + error.message());
        this.method = method;
        this.error = error;
    }

    public String method() { return method; }
    public int code() { return error.code(); }
    public ProtocolError error() { return error; }
}
