package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Out-of-class definitions of a class: static data and functions, nested classes first.
 * Renders as empty text when nothing needs defining.
 */
public class ClassDefinition extends CppDefinition<CppClass> {

    public ClassDefinition(CppClass element, RenderOptions options) {
        super(element, options);
    }

    public List<CppLanguageElement> translationUnitElements() {
        return TranslationUnits.of(element);
    }

    @Override
    public String code(Indentation indentation) {
        Indentation ind = orNew(indentation);
        List<String> definitions = new ArrayList<>();
        for (CppLanguageElement e : translationUnitElements()) {
            definitions.add(ClassCodeFactory.forOwnerOf(e, options).buildDefinition(e).code(ind));
        }
        return String.join("\n", definitions);
    }
}
