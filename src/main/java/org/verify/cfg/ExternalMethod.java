package org.verify.cfg;

import java.util.List;

/**
 * 外部方法的契约：名字 + 前置条件 + 后置条件（按声明顺序）
 */
public class ExternalMethod {
    private String name;
    private List<String> preconditions;
    private List<String> postconditions;

    // Gson 反序列化使用
    ExternalMethod() {
    }

    public ExternalMethod(String name, List<String> preconditions, List<String> postconditions) {
        this.name = name;
        this.preconditions = List.copyOf(preconditions);
        this.postconditions = List.copyOf(postconditions);
    }

    public String getName() {
        return name;
    }

    public List<String> getPreconditions() {
        return preconditions == null ? List.of() : preconditions;
    }

    public List<String> getPostconditions() {
        return postconditions == null ? List.of() : postconditions;
    }
}
