/*
 * Copyright 2019 The Volcano Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package sh.volcano.controllers.job.plugins.ssh;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import sh.volcano.controllers.job.plugins.JobPluginException;

/**
 * Arguments of the ssh plugin, as given in the job spec. Options are accepted with a single or double dash prefix,
 * and option values either inline ({@code --opt=value}) or as the next argument. The {@code no-root} flag takes an
 * optional inline boolean value ({@code --no-root=false}), but never consumes the next argument.
 */
public class SshPluginConfiguration {

    public static final String NO_ROOT_OPTION = "no-root";
    public static final String SSH_KEY_FILE_PATH_OPTION = "ssh-key-file-path";

    private static final Pattern INLINE_NO_ROOT = Pattern.compile("--?" + NO_ROOT_OPTION + "=(.*)");

    private static final Set<String> TRUE_VALUES = ImmutableSet.of("1", "t", "T", "true", "TRUE", "True");
    private static final Set<String> FALSE_VALUES = ImmutableSet.of("0", "f", "F", "false", "FALSE", "False");

    private static final Options OPTIONS = new Options()
            .addOption(Option.builder()
                    .longOpt(NO_ROOT_OPTION)
                    .desc("Mount the keys for a non-root user")
                    .build()
            )
            .addOption(Option.builder()
                    .longOpt(SSH_KEY_FILE_PATH_OPTION)
                    .hasArg()
                    .desc("Path at which the ssh keys are mounted, /root/.ssh by default")
                    .build()
            );

    private final boolean noRoot;
    private final String sshKeyFilePath;

    public SshPluginConfiguration(boolean noRoot, String sshKeyFilePath) {
        this.noRoot = noRoot;
        this.sshKeyFilePath = sshKeyFilePath;
    }

    public boolean isNoRoot() {
        return noRoot;
    }

    public String getSshKeyFilePath() {
        return sshKeyFilePath;
    }

    /**
     * Non-root mode moves the default key location to the volcano configuration directory; an explicit path is kept.
     */
    public static SshPluginConfiguration parse(List<String> arguments) throws JobPluginException {
        // Inline flag values are not understood by DefaultParser, so they are resolved before parsing
        List<String> remaining = new ArrayList<>();
        Boolean inlineNoRoot = null;
        int inlineNoRootPosition = -1;
        for (String argument : arguments) {
            Matcher matcher = INLINE_NO_ROOT.matcher(argument);
            if (matcher.matches()) {
                inlineNoRoot = parseFlagValue(matcher.group(1));
                inlineNoRootPosition = remaining.size();
            } else {
                remaining.add(argument);
            }
        }

        CommandLine commandLine;
        try {
            commandLine = new DefaultParser().parse(OPTIONS, remaining.toArray(new String[0]));
        } catch (ParseException e) {
            throw JobPluginException.invalidArguments(SshPlugin.NAME, e.getMessage(), e);
        }
        if (!commandLine.getArgList().isEmpty()) {
            throw JobPluginException.invalidArguments(SshPlugin.NAME, "unexpected arguments " + commandLine.getArgList(), null);
        }

        boolean noRoot = inlineNoRoot == null
                ? commandLine.hasOption(NO_ROOT_OPTION)
                : inlineNoRoot || hasBareNoRootAfter(remaining, inlineNoRootPosition);
        String path = commandLine.getOptionValue(SSH_KEY_FILE_PATH_OPTION, SshConstants.SSH_ABSOLUTE_PATH);
        if (noRoot && SshConstants.SSH_ABSOLUTE_PATH.equals(path)) {
            path = SshConstants.CONFIG_MAP_MOUNT_PATH + "/" + SshConstants.SSH_RELATIVE_PATH;
        }
        return new SshPluginConfiguration(noRoot, path);
    }

    private static boolean parseFlagValue(String value) {
        if (TRUE_VALUES.contains(value)) {
            return true;
        }
        if (FALSE_VALUES.contains(value)) {
            return false;
        }
        throw JobPluginException.invalidArguments(SshPlugin.NAME, "invalid boolean value '" + value + "' for -" + NO_ROOT_OPTION, null);
    }

    /**
     * The last occurrence of the flag wins.
     */
    private static boolean hasBareNoRootAfter(List<String> arguments, int position) {
        for (int i = position; i < arguments.size(); i++) {
            String argument = arguments.get(i);
            if (argument.equals("-" + NO_ROOT_OPTION) || argument.equals("--" + NO_ROOT_OPTION)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "SshPluginConfiguration{" +
                "noRoot=" + noRoot +
                ", sshKeyFilePath='" + sshKeyFilePath + '\'' +
                '}';
    }
}
