package org.tacgen.app.scriptengine;

import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import java.util.Arrays;
import java.util.List;

import static org.tacgen.core.Configuration.tacgenVersion;

/**
 * The TacScriptEngineFactory class creates {@link TacScriptEngine} instances and describes
 * the engine to the Java Scripting API, which discovers it through
 * {@code META-INF/services/javax.script.ScriptEngineFactory}.
 */
public class TacScriptEngineFactory implements ScriptEngineFactory {

    @Override
    public String getEngineName() {
        return "TACGen";
    }

    @Override
    public String getEngineVersion() {
        return tacgenVersion;
    }

    @Override
    public List<String> getExtensions() {
        return List.of("tac");
    }

    @Override
    public List<String> getMimeTypes() {
        return List.of("text/x-tac");
    }

    @Override
    public List<String> getNames() {
        return Arrays.asList("tacgen", "tac");
    }

    @Override
    public String getLanguageName() {
        return "TAC";
    }

    @Override
    public String getLanguageVersion() {
        return "1.0";
    }

    @Override
    public Object getParameter(String key) {
        switch (key) {
            case ScriptEngine.NAME:
            case ScriptEngine.ENGINE:
                return getEngineName();
            case ScriptEngine.ENGINE_VERSION:
                return getEngineVersion();
            case ScriptEngine.LANGUAGE:
                return getLanguageName();
            case ScriptEngine.LANGUAGE_VERSION:
                return getLanguageVersion();
            default:
                return null;
        }
    }

    @Override
    public String getMethodCallSyntax(String obj, String m, String... args) {
        // the source language has no calls
        return null;
    }

    @Override
    public String getOutputStatement(String toDisplay) {
        // nor output statements
        return null;
    }

    @Override
    public String getProgram(String... statements) {
        return String.join("\n", statements);
    }

    @Override
    public ScriptEngine getScriptEngine() {
        return new TacScriptEngine(this);
    }
}
