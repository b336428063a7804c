/*
 * The MIT License
 *
 * Copyright (c) 2026 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package samstream.cmdline;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import samstream.SamStreamException;
import samstream.sam.ExtractSequenceDictionary;
import samstream.sam.ReformatSam;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * This is the main class of samstream and is the way of executing individual command line programs.
 *
 * The first argument names the program; the remaining arguments are passed to it.
 */
public class SamStreamCommandLine {
    private static final Log log = Log.getInstance(SamStreamCommandLine.class);

    /** The name of this unified command line program **/
    private static final String COMMAND_LINE_NAME = SamStreamCommandLine.class.getSimpleName();

    /** similarity floor for matching in printUnknown **/
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /** The programs available on the command line. **/
    public static List<Class<? extends CommandLineProgram>> getProgramList() {
        final List<Class<? extends CommandLineProgram>> programs = new ArrayList<>();
        programs.add(ReformatSam.class);
        programs.add(ExtractSequenceDictionary.class);
        return programs;
    }

    public static void main(final String[] args) {
        System.exit(new SamStreamCommandLine().instanceMain(args));
    }

    public int instanceMain(final String[] args) {
        final CommandLineProgram program = extractCommandLineProgram(args);
        if (null == program) return 1; // no program found!
        final String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
        return program.instanceMain(mainArgs);
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    /** Returns the command line program specified, or prints the usage and returns null **/
    private static CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : getProgramList()) {
            if (getProgramProperty(clazz) == null) {
                throw new SamStreamException("The class " + clazz.getSimpleName() +
                        " is missing the required CommandLineProgramProperties annotation");
            }
            simpleNameToClass.put(clazz.getSimpleName(), clazz);
        }

        if (args.length < 1 || args[0].equals("-h")) {
            printUsage(simpleNameToClass.values(), false);
        } else if (args[0].equals("--list-commands")) {
            printUsage(simpleNameToClass.values(), true);
        } else if (simpleNameToClass.containsKey(args[0])) {
            final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
            try {
                return clazz.getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new SamStreamException("Failure instantiating command line program: " + clazz.getName(), e);
            }
        } else {
            printUsage(simpleNameToClass.values(), false);
            printUnknown(simpleNameToClass.values(), args[0]);
        }
        return null;
    }

    private static void printUsage(final Iterable<Class<? extends CommandLineProgram>> classes, final boolean commandListOnly) {
        final StringBuilder builder = new StringBuilder();
        if (!commandListOnly) {
            builder.append("USAGE: ").append(COMMAND_LINE_NAME).append(" <program name> [-h]\n\n");
            builder.append("Available Programs:\n");
        }

        /** Group CommandLinePrograms by CommandLineProgramGroup **/
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groupInstances = new HashMap<>();
        final Map<CommandLineProgramGroup, List<Class<?>>> programsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            CommandLineProgramGroup programGroup = groupInstances.get(property.programGroup());
            if (null == programGroup) {
                try {
                    programGroup = property.programGroup().getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new SamStreamException("Failure instantiating program group: " + property.programGroup().getName(), e);
                }
                groupInstances.put(property.programGroup(), programGroup);
            }
            programsByGroup.computeIfAbsent(programGroup, g -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = entry.getKey();
            if (!commandListOnly) {
                builder.append("--------------------------------------------------------------------------------------\n");
                builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));
            }

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(Comparator.comparing(Class::getSimpleName));
            for (final Class<?> clazz : sortedClasses) {
                if (commandListOnly) {
                    builder.append(clazz.getSimpleName()).append("\n");
                } else {
                    builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary()));
                }
            }
            if (!commandListOnly) builder.append("\n");
        }
        if (commandListOnly) {
            System.out.print(builder);
        } else {
            builder.append("--------------------------------------------------------------------------------------\n\n");
            System.err.print(builder);
        }
    }

    /** When a command does not match any known command, searches for similar commands, using the same method as GIT **/
    private static void printUnknown(final Iterable<Class<? extends CommandLineProgram>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new HashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;
        int numClasses = 0;

        for (final Class<?> clazz : classes) {
            ++numClasses;
            final String name = clazz.getSimpleName();
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(clazz, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == numClasses) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        log.error(String.format("'%s' is not a valid command. See %s -h for more information.", command, COMMAND_LINE_NAME));
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            System.err.println(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            for (final Map.Entry<Class<?>, Integer> entry : distances.entrySet()) {
                if (bestDistance == entry.getValue()) {
                    System.err.println(String.format("        %s", entry.getKey().getSimpleName()));
                }
            }
        }
    }
}
