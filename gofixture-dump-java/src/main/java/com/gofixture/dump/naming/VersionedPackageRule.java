package com.gofixture.dump.naming;

import java.util.regex.Pattern;

/**
 * Disambiguates API-version packages that share a name.
 *
 * Kubernetes-style APIs declare same-named types in many packages called {@code v1},
 * {@code v1beta1} and so on. Such a package is qualified by its parent directory name
 * followed by the version: {@code k8s.io/api/apps/v1} → {@code appsv1},
 * {@code k8s.io/apimachinery/pkg/apis/meta/v1} → {@code metav1}.
 */
public final class VersionedPackageRule implements QualifierRule {

    public static final Pattern API_VERSION = Pattern.compile("v\\d+((alpha|beta)\\d+)?");

    private final Pattern versionPattern;

    public VersionedPackageRule() {
        this(API_VERSION);
    }

    public VersionedPackageRule(Pattern versionPattern) {
        this.versionPattern = versionPattern;
    }

    @Override
    public String alias(String pkgPath, String pkgName) {
        if (!versionPattern.matcher(pkgName).matches()) {
            return null;
        }
        int slash = pkgPath.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        String parent = pkgPath.substring(0, slash);
        String group = parent.substring(parent.lastIndexOf('/') + 1).replaceAll("[^A-Za-z0-9_]", "");
        if (group.isEmpty() || Character.isDigit(group.charAt(0))) {
            return null;
        }
        return group + pkgName;
    }
}
