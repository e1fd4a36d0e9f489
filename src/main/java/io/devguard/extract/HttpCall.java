package io.devguard.extract;

import io.devguard.model.Provenance;

/**
 * A frontend HTTP call site with a literal (or template) URL.
 *
 * @param sourceId   node containing the call
 * @param verb       upper-case HTTP verb, GET when not stated
 * @param url        URL literal; dynamic parts are rendered as {@code {param}}
 * @param provenance where the call appears
 */
public record HttpCall(String sourceId, String verb, String url, Provenance provenance) {

    public String display() {
        return verb + " " + url;
    }
}
