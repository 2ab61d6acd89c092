package io.specbridge.toolbox.remotehttp;

import io.specbridge.core.tools.HttpMethod;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * A fully resolved remote HTTP call for one tool invocation. The path is already substituted and escaped. Null
 * valued arguments have been pruned from query and body.
 */
@Value
@Builder
@With
public class HttpCallSpec {
    @NonNull
    String toolName;

    @NonNull
    HttpMethod method;

    @NonNull
    String path;

    /**
     * Query parameters. A parameter with several values is sent repeated.
     */
    @Singular("queryParameter")
    Map<String, List<String>> query;

    /**
     * JSON body members. <code>null</code> when the operation takes no body.
     */
    Map<String, Object> body;
}
