@GoPackage("k8s.io/api/apps/v1")
package com.gofixture.dump.fixtures.apps;

import com.gofixture.dump.annotation.GoPackage;
