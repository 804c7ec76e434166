package org.verify.cfg;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 外部方法契约表：方法名 -> 前置/后置条件
 * <p>
 * 只在启动时加载一次，之后只读。按名字精确匹配，不区分重载。
 */
public class ContractRegistry {

    private static final Logger LOG = LogManager.getLogger(ContractRegistry.class);

    private final List<ExternalMethod> methods;

    public ContractRegistry(List<ExternalMethod> methods) {
        this.methods = List.copyOf(methods);
    }

    public static ContractRegistry empty() {
        return new ContractRegistry(List.of());
    }

    /**
     * 从 JSON 文件加载契约表；文件不存在、读不了或格式错误时记录警告并返回空表
     */
    public static ContractRegistry load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            RegistryFile parsed = new Gson().fromJson(reader, RegistryFile.class);
            if (parsed == null || parsed.externalMethods == null) {
                LOG.warn("Contract registry {} has no externalMethods, using an empty registry", file);
                return empty();
            }
            List<ExternalMethod> valid = new ArrayList<>();
            for (ExternalMethod m : parsed.externalMethods) {
                if (m == null || m.getName() == null) {
                    LOG.warn("Skipping contract entry without a name in {}", file);
                    continue;
                }
                valid.add(m);
            }
            LOG.info("Loaded {} external contracts from {}", valid.size(), file);
            return new ContractRegistry(valid);
        } catch (IOException | JsonParseException e) {
            LOG.warn("Failed to load external conditions from {}: {}", file, e.toString());
            return empty();
        }
    }

    /**
     * 按名字查找契约，多个同名条目时取第一个
     */
    public Optional<ExternalMethod> find(String name) {
        for (ExternalMethod m : methods) {
            if (m.getName().equals(name)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return methods.size();
    }

    // JSON 根对象：{"externalMethods": [...]}
    private static class RegistryFile {
        List<ExternalMethod> externalMethods;
    }
}
