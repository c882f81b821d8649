package org.assemblerflow.qc.utils.runtime;

import org.assemblerflow.qc.utils.Utils;

public final class RuntimeUtils {

    private RuntimeUtils(){}

    /**
     * Given a Class that is a CommandLineProgram, return a display name suitable for presentation to the user.
     * @param toolClass A CommandLineProgram class object may not be null
     * @return tool display name
     */
    public static String toolDisplayName(final Class<?> toolClass) {
        Utils.nonNull(toolClass, "A valid class is required to get a display name");
        return toolClass.getSimpleName();
    }

    /**
     * @param clazz class to use when looking up the Implementation-Title
     * @return The name of this toolkit, uses "Implementation-Title" from the
     *         jar manifest of the given class, or (if that's not available) the package name.
     */
    public static String getToolkitName(Class<?> clazz) {
        final String implementationTitle = clazz.getPackage().getImplementationTitle();
        return implementationTitle != null ? implementationTitle : clazz.getPackage().getName();
    }

    /**
     * @return get the implementation version of the given class
     */
    public static String getVersion(Class<?> clazz){
        String versionString = clazz.getPackage().getImplementationVersion();
        return versionString != null ? versionString : "Unavailable";
    }
}
