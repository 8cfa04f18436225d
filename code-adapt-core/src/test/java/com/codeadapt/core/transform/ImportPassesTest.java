package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.directive.TransformationDirective.Rename;
import com.codeadapt.core.directive.TransformationDirective.ReplaceImport;
import com.codeadapt.core.generator.JavaScriptCodeGenerator;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the import, rename and naming passes.
 */
class ImportPassesTest {

    private final JavaScriptCodeGenerator generator = new JavaScriptCodeGenerator();
    private TransformContext context;

    @BeforeEach
    void setUp() {
        context = new TransformContext(CustomizationMetadata.empty(), Set.of());
    }

    private String apply(TransformationPass pass, String source) {
        return generator.generate(pass.apply(JavaScriptAstParser.parse(source), context));
    }

    @Test
    void replaceImport_requireAndDynamicImport_areRewritten() {
        String code = apply(new ReplaceImportPass(new ReplaceImport("axios", "ky", null)), """
            const http = require('axios');
            const lazy = import('axios');
            export { get } from 'axios';
            """);

        assertThat(code).isEqualTo("""
            const http = require('ky');
            const lazy = import('ky');
            export { get } from 'ky';
            """);
    }

    @Test
    void replaceImport_keepsBindingsWithoutStyle() {
        String code = apply(new ReplaceImportPass(new ReplaceImport("old", "new", null)),
            "import Def, { a as b } from 'old';");

        assertThat(code).isEqualTo("import Def, { a as b } from 'new';\n");
    }

    @Test
    void replaceImport_noMatchingModule_warnsNoMatch() {
        apply(new ReplaceImportPass(new ReplaceImport("moment", "dayjs", null)), "import x from 'lodash';");

        assertThat(context.warnings()).extracting(AdaptationWarning::type).containsExactly(WarningType.NO_MATCH);
    }

    @Test
    void importStyle_namedToDefault_convertsSingleSpecifiers() {
        String code = apply(new ImportStylePass(ImportStyle.NAMED, ImportStyle.DEFAULT), """
            import { Button } from './Button';
            import { a, b } from './ab';
            """);

        assertThat(code).isEqualTo("import Button from './Button';\nimport { a, b } from './ab';\n");
    }

    @Test
    void importStyle_toNamespace_isUnsupported() {
        Program program = JavaScriptAstParser.parse("import x from 'x';");

        Program result = new ImportStylePass(ImportStyle.DEFAULT, ImportStyle.NAMESPACE).apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNSUPPORTED_PATTERN_CONVERSION);
    }

    @Test
    void rename_membersAndKeys_areNotTouched() {
        String code = apply(new RenamePass(new Rename("identifier", "user", "account")),
            "const user = load();\nsend({ user: user.user });");

        assertThat(code).isEqualTo("const account = load();\nsend({\n  user: account.user\n});\n");
    }

    @Test
    void rename_builtin_isSkipped() {
        apply(new RenamePass(new Rename("identifier", "console", "logger")), "console.log(1);");

        assertThat(context.warnings()).extracting(AdaptationWarning::type).containsExactly(WarningType.NO_MATCH);
    }

    @Test
    void naming_skipsBuiltinsAndPascalNames() {
        String code = apply(new NamingConventionPass(NamingConvention.CAMEL_CASE, NamingConvention.SNAKE_CASE),
            "const userName = useState(Button);");

        assertThat(code).isEqualTo("const user_name = useState(Button);\n");
    }

    @Test
    void naming_toKebabCase_isUnsupported() {
        Program program = JavaScriptAstParser.parse("const userName = 1;");

        Program result = new NamingConventionPass(NamingConvention.CAMEL_CASE, NamingConvention.KEBAB_CASE)
            .apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNSUPPORTED_PATTERN_CONVERSION);
    }
}
