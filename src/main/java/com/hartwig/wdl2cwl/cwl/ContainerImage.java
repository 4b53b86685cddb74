package com.hartwig.wdl2cwl.cwl;

import java.util.Optional;

import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.Task;

/**
 * The container image of a task, seen as a tool input. An image taken from a task input uses that input; a literal
 * image becomes a string input of its own with the literal as default, so callers can always override it.
 */
public final class ContainerImage {
    static final String SYNTHETIC_INPUT = "docker_image";

    private final String inputName;
    private final String defaultImage;
    private final Expression computed;

    private ContainerImage(String inputName, String defaultImage, Expression computed) {
        this.inputName = inputName;
        this.defaultImage = defaultImage;
        this.computed = computed;
    }

    public static Optional<ContainerImage> of(Task task) {
        if (task.runtime().image().isEmpty()) {
            return Optional.empty();
        }
        var image = task.runtime().image().get();
        var input = inputBehind(task, image, 0);
        if (input.isPresent()) {
            return Optional.of(new ContainerImage(input.get(), null, null));
        }
        if (image instanceof Literal && ((Literal) image).type() == Literal.Type.STRING) {
            return Optional.of(new ContainerImage(syntheticName(task), ((Literal) image).text(), null));
        }
        return Optional.of(new ContainerImage(null, null, image));
    }

    /**
     * Tool input holding the image, empty when the image is computed from several values.
     */
    public Optional<String> inputName() {
        return Optional.ofNullable(inputName);
    }

    /**
     * Literal image of a synthetic image input.
     */
    public Optional<String> defaultImage() {
        return Optional.ofNullable(defaultImage);
    }

    public boolean isSynthetic() {
        return defaultImage != null;
    }

    public Optional<Expression> computed() {
        return Optional.ofNullable(computed);
    }

    private static Optional<String> inputBehind(Task task, Expression image, int depth) {
        if (!(image instanceof Reference) || !((Reference) image).members().isEmpty() || depth > task.declarations().size()) {
            return Optional.empty();
        }
        var root = ((Reference) image).root();
        if (task.findInput(root).isPresent()) {
            return Optional.of(root);
        }
        return task.findDeclaration(root).flatMap(Parameter::expression).flatMap(value -> inputBehind(task, value, depth + 1));
    }

    private static String syntheticName(Task task) {
        var name = SYNTHETIC_INPUT;
        var suffix = 1;
        while (task.findInput(name).isPresent() || task.findDeclaration(name).isPresent()) {
            name = SYNTHETIC_INPUT + "_" + suffix++;
        }
        return name;
    }
}
