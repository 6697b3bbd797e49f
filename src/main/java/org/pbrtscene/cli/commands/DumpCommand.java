package org.pbrtscene.cli.commands;

import com.google.gson.Gson;
import org.pbrtscene.cli.CommandLineInterface;
import org.pbrtscene.loader.LoaderOptions;
import org.pbrtscene.loader.SceneLoader;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.scene.Scene;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "dump", description = "Loads a scene file and prints the resulting scene as JSON.")
public class DumpCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The top-level scene file.")
    private File file;

    @Option(names = {"-s", "--summary"}, description = "Print only the number of entities of each kind.")
    private boolean summary;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        LoaderOptions options = LoaderOptions.fromConfig(parent.getConfig());
        PrintWriter out = spec.commandLine().getOut();

        Scene scene;
        try {
            scene = new SceneLoader(options).load(file.toPath());
        } catch (SceneLoadException e) {
            spec.commandLine().getErr().println("Failed to load " + file + ": " + e.getMessage());
            return 1;
        }

        if (summary) {
            out.println("camera:      " + (scene.camera() != null ? 1 : 0));
            out.println("shapes:      " + scene.shapes().size());
            out.println("lights:      " + scene.lights().size());
            out.println("area lights: " + scene.areaLights().size());
            out.println("materials:   " + scene.materials().size());
            out.println("textures:    " + scene.textures().size());
            out.println("mediums:     " + scene.mediums().size());
        } else {
            Gson gson = SceneJson.create();
            out.println(gson.toJson(scene));
        }
        out.flush();
        return 0;
    }
}
