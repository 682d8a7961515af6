package com.juno.sandbox;

import java.util.Map;

/**
 * Runs untrusted code snippets in isolation.
 */
public interface CodeSandbox {

    /**
     * @param code    source to execute
     * @param context values made available to the code
     */
    SandboxResult submit(String code, Map<String, Object> context);
}
