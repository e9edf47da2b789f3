package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.List;

@FunctionalInterface
public interface TemplateFunction {
    Value apply(List<Value> args, RenderContext context);
}
