package com.walkforage.core;

import com.walkforage.core.content.ClasspathContentSource;
import com.walkforage.core.content.ContentIntegrityException;
import com.walkforage.core.content.GameContent;
import com.walkforage.core.content.GameContentLoader;
import com.walkforage.core.infrastructure.CoreConfig;
import com.walkforage.core.ports.IContentSource;

/**
 * Content gate: loads the bundled tables, runs the integrity suite and exits non-zero on any violation.
 */
public class Main {

    public static void main(String[] args) {
        System.out.println("🌿 WalkForage Core Starting...");
        CoreConfig.load();

        String path = (args.length > 0) ? args[0] : CoreConfig.getString("content.path", "content");
        System.exit(runContentCheck(new ClasspathContentSource(path)));
    }

    static int runContentCheck(IContentSource source) {
        try {
            GameContent content = new GameContentLoader(source).loadValidated();
            System.out.println("✅ [System] " + content.getTechGraph().getRoots().size() + " root technologies, "
                    + content.getCraftableGraph().getRoots().size() + " root craftables.");
            return 0;
        } catch (ContentIntegrityException e) {
            System.err.println("🚨 [System] Content rejected: " + e.getMessage());
            for (String v : e.getViolations()) System.err.println("❌ " + v);
            return 1;
        }
    }
}
