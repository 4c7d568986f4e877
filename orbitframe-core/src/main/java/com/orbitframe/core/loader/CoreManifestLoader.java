package com.orbitframe.core.loader;

import com.orbitframe.api.exception.ErrorCode;
import com.orbitframe.api.exception.OrbitException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 内核清单加载器（YAML）
 */
@Slf4j
public class CoreManifestLoader {

    private CoreManifestLoader() {
    }

    public static CoreManifest load(InputStream inputStream) {
        if (inputStream == null) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Manifest stream cannot be null");
        }
        // SnakeYAML 2.x 需要显式传入 LoaderOptions，全局 tag 保持默认限制
        LoaderOptions options = new LoaderOptions();

        Constructor constructor = new Constructor(CoreManifest.class, options);
        TypeDescription root = new TypeDescription(CoreManifest.class);
        root.addPropertyParameters("plugins", PluginManifest.class);
        constructor.addTypeDescription(root);

        Yaml yaml = new Yaml(constructor);
        CoreManifest manifest;
        try {
            manifest = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Invalid core manifest: " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Core manifest is empty");
        }
        log.debug("[manifest] Loaded {}@{} with {} plugin(s)", manifest.getServiceName(), manifest.getVersion(),
                manifest.getPlugins() == null ? 0 : manifest.getPlugins().size());
        return manifest;
    }

    public static CoreManifest load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new OrbitException(ErrorCode.CONFIG_ERROR, "Cannot read core manifest " + path, e);
        }
    }
}
