package com.project.image.enhancement.service.superres;

@FunctionalInterface
public interface SuperResolutionBackendFactory {

    SuperResolutionBackend create();
}
