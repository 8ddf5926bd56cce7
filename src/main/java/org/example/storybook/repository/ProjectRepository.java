package org.example.storybook.repository;

import org.example.storybook.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Storage for projects and their stories.
 */
public interface ProjectRepository {

    Project save(Project project);

    Optional<Project> findById(String projectId);

    List<Project> findAll();

    boolean deleteById(String projectId);
}
