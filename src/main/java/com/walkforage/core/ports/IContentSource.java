package com.walkforage.core.ports;

import java.io.IOException;
import java.io.Reader;

/**
 * Where the static content tables come from (classpath, a directory, a test fixture).
 * Names are relative paths such as {@code technologies.json} or {@code materials/stone.json}.
 */
public interface IContentSource {

    boolean exists(String name);

    Reader open(String name) throws IOException;

    String describe();
}
