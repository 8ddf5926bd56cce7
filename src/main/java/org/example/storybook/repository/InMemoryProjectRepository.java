package org.example.storybook.repository;

import org.example.storybook.model.Project;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryProjectRepository implements ProjectRepository {

    private final ConcurrentMap<String, Project> projects = new ConcurrentHashMap<>();

    @Override
    public Project save(Project project) {
        projects.put(project.getId(), project);
        return project;
    }

    @Override
    public Optional<Project> findById(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public List<Project> findAll() {
        List<Project> all = new ArrayList<>(projects.values());
        all.sort(Comparator.comparing(Project::getCreatedAt).reversed());
        return all;
    }

    @Override
    public boolean deleteById(String projectId) {
        return projects.remove(projectId) != null;
    }
}
