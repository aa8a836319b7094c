package org.slngen.generator;

/**
 * Thrown when two declaration files declare the same module name.
 */
public class DuplicateModuleNameException extends GeneratorException {

    private final String moduleName;

    public DuplicateModuleNameException(String moduleName, String firstPath, String secondPath) {
        super("Duplicate module name '" + moduleName + "' declared in " + firstPath + " and " + secondPath);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
