package com.branchflow.core.naming;

import com.branchflow.core.model.BranchDescriptor;
import com.branchflow.core.model.BranchKind;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a branch name into a {@link BranchDescriptor}.
 *
 * <p>Rules are applied in priority order:
 * <ol>
 *   <li>{@code master}: master</li>
 *   <li>{@code d{n}}: development, sequence {@code n}</li>
 *   <li>{@code r{n}}: release, sequence {@code n}</li>
 *   <li>{@code hotfix/...}: hotfix, parent release taken from the first {@code r{n}} token
 *       after the prefix, if any</li>
 *   <li>anything else: unknown</li>
 * </ol>
 * Matching is exact and case-sensitive. Sequence numbers may have any number of digits.
 */
public final class BranchClassifier {

    public static final String MASTER = "master";

    static final Pattern DEVELOPMENT = Pattern.compile("^d(\\d+)$");
    static final Pattern RELEASE = Pattern.compile("^r(\\d+)$");
    static final Pattern RELEASE_TOKEN = Pattern.compile("r(\\d+)");

    private BranchClassifier() {
        // utility class
    }

    public static BranchDescriptor classify(String name) {
        if (name == null || name.isEmpty()) {
            return unknown(name == null ? "" : name);
        }
        if (MASTER.equals(name)) {
            return new BranchDescriptor(name, BranchKind.MASTER, null, null);
        }

        Matcher dev = DEVELOPMENT.matcher(name);
        if (dev.matches()) {
            return new BranchDescriptor(name, BranchKind.DEVELOPMENT, new BigInteger(dev.group(1)), null);
        }

        Matcher release = RELEASE.matcher(name);
        if (release.matches()) {
            return new BranchDescriptor(name, BranchKind.RELEASE, new BigInteger(release.group(1)), null);
        }

        if (name.startsWith(BranchDescriptor.HOTFIX_PREFIX)
                && name.length() > BranchDescriptor.HOTFIX_PREFIX.length()) {
            String remainder = name.substring(BranchDescriptor.HOTFIX_PREFIX.length());
            Matcher token = RELEASE_TOKEN.matcher(remainder);
            BigInteger parent = token.find() ? new BigInteger(token.group(1)) : null;
            return new BranchDescriptor(name, BranchKind.HOTFIX, null, parent);
        }

        return unknown(name);
    }

    private static BranchDescriptor unknown(String name) {
        return new BranchDescriptor(name, BranchKind.UNKNOWN, null, null);
    }
}
