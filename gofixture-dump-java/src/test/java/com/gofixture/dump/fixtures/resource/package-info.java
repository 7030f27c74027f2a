@GoPackage("k8s.io/apimachinery/pkg/api/resource")
package com.gofixture.dump.fixtures.resource;

import com.gofixture.dump.annotation.GoPackage;
