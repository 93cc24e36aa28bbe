package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.Visibility;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.DocsStyle;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Class declaration. Access specifiers are only written where the visibility changes, starting
 * from the default visibility of the class kind.
 *
 * <pre>
 * class Dog : public Animal {
 *     int x;
 * public:
 *     void Foo();
 * };
 * </pre>
 */
public class ClassDeclaration extends CppDeclaration<CppClass> {

    private final ClassCodeFactory factory;

    public ClassDeclaration(CppClass element, RenderOptions options) {
        super(element, options);
        this.factory = new ClassCodeFactory(element.name, this.options);
    }

    protected String keyword() {
        return "class";
    }

    protected String inheritance() {
        List<String> parents = new ArrayList<>();
        for (CppClass.Parent p : element.getParents()) {
            parents.add(p.visibility.keyword + " " + p.name);
        }
        return parents.isEmpty() ? "" : " : " + String.join(", ", parents);
    }

    protected void declarations(BraceStrategy block, Indentation indentation) {
        Visibility last = element.defaultVisibility();
        for (CppClass.Member member : element.getElements()) {
            if (member.visibility != last) {
                // labels sit one level above the members, unless the block did not indent at all
                boolean dedent = indentation.level() > 0;
                if (dedent) indentation.decrement();
                block.writeLine(member.visibility.keyword + ":");
                if (dedent) indentation.increment();
                last = member.visibility;
            }
            String code = factory.buildDeclaration(member.element).code(indentation);
            String docs = member.element.getDocs();
            if (docs == null || docs.isEmpty()) {
                block.writeLine(code);
            } else if (options.docsStyle == DocsStyle.ABOVE) {
                block.writeLines(docs);
                block.writeLine(code);
            } else {
                block.writeLine(code + docs);
            }
        }
    }

    @Override
    public String code(Indentation indentation) {
        Indentation ind = orNew(indentation);
        StringBuilder code = new StringBuilder();
        code.append(keyword()).append(' ').append(element.name).append(inheritance());
        try (BraceStrategy block = options.braceStyle.open(code, ind, ";")) {
            declarations(block, ind);
        }
        return code.toString();
    }
}
