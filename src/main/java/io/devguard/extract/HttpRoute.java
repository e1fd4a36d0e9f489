package io.devguard.extract;

/**
 * A backend route declared by an Endpoint node.
 *
 * @param verb upper-case HTTP verb
 * @param path route template as declared, including any router prefix
 */
public record HttpRoute(String verb, String path) {

    public String display() {
        return verb + " " + path;
    }
}
