package com.codeadapt.core.generator;

import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JavaScriptCodeGenerator}.
 */
class JavaScriptCodeGeneratorTest {

    private final JavaScriptCodeGenerator generator = new JavaScriptCodeGenerator();

    @ParameterizedTest
    @ValueSource(strings = {
        "import React, { useState as state } from 'react';",
        "export default function App(props) { return props.children; }",
        "export const total = (a + b) * c;",
        "const handler = async ({ id, ...rest }, [first] = []) => { await save(id, rest); };",
        "class Store extends Base { static count = 0; get size() { return this.items.length; } }",
        "for (const key of Object.keys(map)) { if (!key) continue; else total += map[key]; }",
        "try { run(); } catch (e) { console.error(e); } finally { done(); }",
        "const label = `Hello ${user?.name ?? 'guest'}`;",
        "switch (mode) { case 'a': start(); break; default: stop(); }",
        "const result = cond ? new Widget() : typeof value === 'string' && x ** 2 > -1;",
        "module.exports = { handler, retries: 3, 'content-type': \"json\" };",
        "outer: for (const row of rows) { for (const cell of row) { if (!cell) continue outer; } }",
        "async function drain(queue) { for await (const job of queue) { await job.run(); } }",
        "const path = `a${`d${e}`}/${{ b: 1 }.b}`;",
        "const worker = new Worker(new URL('./task.js', import.meta.url));",
        "function Widget() { if (!new.target) throw new Error('use new'); }",
        "function pause() { debugger; }",
        "const shift = (a >> 2) + (b >>> 1) + (c << 3); mask >>= 1; bits >>>= 2;",
        "const config = {\n  // the api key\n  apiKey: 'a',\n  /* base */ baseUrl: 'b' // trailing\n};\nfoo(/* arg */ 1, [/* none */]);",
        "send(\n  payload, // body\n  headers /* optional */\n);",
        "class Counter {\n  // current count\n  count = 0;\n  /* bump */\n  inc() { this.count++; }\n}",
        "interface User { id: string; roles?: string[]; }\nfunction f(u: User): string { return u.id; }",
        "type Handler<T> = (event: T) => Promise<void>;\nexport enum Level { Low, High = 2 }",
        "import type { Request } from 'express';\nconst decoded = verify(token) as TokenPayload;\nconst root = document.getElementById('root')!;",
        "export class Repo<T> extends Base implements Store<T>, Closeable { private readonly items: T[] = []; constructor(private db: Db) { super(); } async find(id?: string): Promise<T | null> { return null; } }",
        "export const authorize = (...roles: string[]) => (req: Request, res: Response, next: NextFunction): void => next();",
        "const total = items.reduce<number>((sum, item) => sum + item.price, 0); const map = new Map<string, number[]>();",
        "export function Button() { return <div>Hi</div>; }",
        "const view = <button type=\"button\" {...rest} onClick={() => track(label)} disabled>{label}</button>;",
        "const list = <><Item key=\"a\" />{items.map((item) => <Item {...item} />)}{/* empty */}</>;"
    })
    void generate_reparse_producesEqualTree(String source) {
        Program parsed = JavaScriptAstParser.parse(source);

        String generated = generator.generate(parsed);

        assertThat(JavaScriptAstParser.parse(generated)).isEqualTo(parsed);
    }

    @Test
    void generate_function_printsIndentedBody() {
        String generated = generator.generate(JavaScriptAstParser.parse("function doThing(a){return a;}"));

        assertThat(generated).isEqualTo("function doThing(a) {\n  return a;\n}\n");
    }

    @Test
    void generate_importSpecifiers_printsAliasOnlyWhenNamesDiffer() {
        String generated = generator.generate(JavaScriptAstParser.parse("import { a as a, b as c } from \"lib\";"));

        assertThat(generated).isEqualTo("import { a, b as c } from 'lib';\n");
    }

    @Test
    void generate_builtArrowCallee_addsParentheses() {
        Expression arrow = new ArrowFunctionExpression(List.of(), new Identifier("x"), false);
        Program program = new Program(List.of(
            new ExpressionStatement(new CallExpression(arrow, List.of(), false))));

        assertThat(generator.generate(program)).isEqualTo("(() => x)();\n");
    }

    @Test
    void generate_builtBinaryTree_parenthesizesByPrecedence() {
        Expression sum = new BinaryExpression("+", new Identifier("a"), new Identifier("b"));
        Expression product = new BinaryExpression("*", sum, new Identifier("c"));
        Expression difference = new BinaryExpression("-", new Identifier("a"),
            new BinaryExpression("-", new Identifier("b"), new Identifier("c")));

        assertThat(generator.generateExpression(product)).isEqualTo("(a + b) * c");
        assertThat(generator.generateExpression(difference)).isEqualTo("a - (b - c)");
    }

    @Test
    void generate_doubleQuoteStyle_rewritesPlainStrings() {
        JavaScriptCodeGenerator doubleQuotes = new JavaScriptCodeGenerator(
            new StyleConfig(2, StyleConfig.QuoteStyle.DOUBLE, false));

        String generated = doubleQuotes.generate(JavaScriptAstParser.parse(
            "import x from 'x';\nconst a = 'plain';\nconst b = 'it\"s';"));

        assertThat(generated).isEqualTo(
            "import x from \"x\";\nconst a = \"plain\";\nconst b = 'it\"s';\n");
    }

    @Test
    void generate_trailingComment_staysOnSameLine() {
        String generated = generator.generate(JavaScriptAstParser.parse("const a = 1; // one\nconst b = 2;"));

        assertThat(generated).isEqualTo("const a = 1; // one\nconst b = 2;\n");
    }

    @Test
    void generate_commentsInsideObjectsAndArguments_arePreserved() {
        String generated = generator.generate(JavaScriptAstParser.parse("""
            const config = {
              // the api key
              apiKey: 'a',
              /* base */ baseUrl: 'b'
            };
            foo(/* arg */ 1);
            """));

        assertThat(generated).isEqualTo("""
            const config = {
              // the api key
              apiKey: 'a',
              /* base */
              baseUrl: 'b'
            };
            foo(/* arg */ 1);
            """);
    }

    @Test
    void generate_lineCommentBeforeArgument_breaksLine() {
        String generated = generator.generate(JavaScriptAstParser.parse("send(payload, // body\nheaders);"));

        assertThat(generated).isEqualTo("send(payload, // body\n  headers);\n");
    }

    @Test
    void generate_typeScriptSignatures_keepTypeText() {
        String generated = generator.generate(JavaScriptAstParser.parse(
            "async function findUser(id:string,opts?:Options):Promise<User|null>{return null;}"));

        assertThat(generated).isEqualTo(
            "async function findUser(id: string, opts?: Options): Promise<User|null> {\n  return null;\n}\n");
    }

    @Test
    void generate_multiLineInterface_reindentsAtNestingDepth() {
        String generated = generator.generate(JavaScriptAstParser.parse("""
            export function setup() {
              return 1;
            }
            interface TokenPayload {
              userId: string;
              role?: string;
            }
            """));

        assertThat(generated).endsWith("interface TokenPayload {\n  userId: string;\n  role?: string;\n}\n");
    }

    @Test
    void generate_jsxElement_printsTagsAndChildren() {
        String generated = generator.generate(JavaScriptAstParser.parse(
            "const el = <Card   title='Hi'  {...props}><span>{count}</span></Card>;"));

        assertThat(generated).isEqualTo("const el = <Card title='Hi' {...props}><span>{count}</span></Card>;\n");
    }

    @Test
    void generate_emptyProgram_returnsEmptyString() {
        assertThat(generator.generate(new Program(List.of()))).isEmpty();
    }
}
