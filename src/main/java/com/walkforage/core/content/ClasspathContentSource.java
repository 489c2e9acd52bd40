package com.walkforage.core.content;

import com.walkforage.core.ports.IContentSource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

public class ClasspathContentSource implements IContentSource {

    private final String basePath;
    private final ClassLoader classLoader;

    public ClasspathContentSource(String basePath) {
        this(basePath, ClasspathContentSource.class.getClassLoader());
    }

    public ClasspathContentSource(String basePath, ClassLoader classLoader) {
        String p = (basePath != null) ? basePath.trim() : "";
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        this.basePath = p;
        this.classLoader = classLoader;
    }

    @Override
    public boolean exists(String name) {
        return classLoader.getResource(resolve(name)) != null;
    }

    @Override
    public Reader open(String name) throws IOException {
        String path = resolve(name);
        InputStream in = classLoader.getResourceAsStream(path);
        if (in == null) throw new FileNotFoundException("classpath:" + path);
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return "classpath:" + (basePath.isEmpty() ? "/" : basePath);
    }

    private String resolve(String name) {
        return basePath.isEmpty() ? name : basePath + "/" + name;
    }
}
