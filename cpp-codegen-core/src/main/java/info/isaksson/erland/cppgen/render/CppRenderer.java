package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppLanguageElement;

/**
 * Entry points: declaration or definition text for any supported element.
 */
public final class CppRenderer {

    private CppRenderer() {}

    public static String declaration(CppLanguageElement element, RenderOptions options) {
        return ClassCodeFactory.forOwnerOf(element, options).buildDeclaration(element).code();
    }

    public static String definition(CppLanguageElement element, RenderOptions options) {
        return ClassCodeFactory.forOwnerOf(element, options).buildDefinition(element).code();
    }

    public static String declarationWithDocs(CppLanguageElement element, RenderOptions options) {
        return ClassCodeFactory.forOwnerOf(element, options).buildDeclaration(element).codeWithDocs();
    }

    public static String definitionWithDocs(CppLanguageElement element, RenderOptions options) {
        return ClassCodeFactory.forOwnerOf(element, options).buildDefinition(element).codeWithDocs();
    }
}
