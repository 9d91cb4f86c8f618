package mf.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for syntax tree classes annotated with {@link ASTNode}.
 *
 * <p>For every annotated class a {@code <Outer>_<Name>_ASTNode} interface is written next to it,
 * declaring its {@link ASTChild} accessors and default {@code accept} / {@code visitChildren}
 * methods. Once all rounds are done, {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code
 * VoidDefaultASTVisitor} are written with one visit method per annotated class. All annotated
 * classes must live in one package, which also holds {@code ASTNodeInterface} and {@code
 * ASTNodeUtils}.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final TypeVariableName V = TypeVariableName.get("V");

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  // Sorted by canonical name so the generated visitors are stable between builds.
  private final Set<ClassName> allAstNodes =
      new TreeSet<>((a, b) -> a.toString().compareTo(b.toString()));
  private Optional<String> targetPackage = Optional.empty();

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (!allAstNodes.isEmpty()) {
          generateASTVisitorFiles();
        }
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  private ClassName packageClass(String simpleName) {
    return ClassName.get(targetPackage.get(), simpleName);
  }

  private void writeType(TypeSpec typeSpec) throws IOException {
    JavaFile.builder(targetPackage.get(), typeSpec)
        .skipJavaLangImports(true)
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private MethodSpec.Builder visitMethod(ClassName node, TypeName valueType) {
    return MethodSpec.methodBuilder("visit")
        .addModifiers(Modifier.PUBLIC)
        .returns(valueType)
        .addParameter(ParameterSpec.builder(node, "node").build())
        .addParameter(ParameterSpec.builder(valueType, "value").build());
  }

  private void generateASTVisitorFiles() throws IOException {
    ClassName visitorName = packageClass("ASTVisitor");
    ClassName defaultVisitorName = packageClass("DefaultASTVisitor");
    TypeName voidName = ClassName.get(Void.class);

    TypeSpec.Builder visitor = TypeSpec.interfaceBuilder(visitorName).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(defaultVisitorName)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(visitorName, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(packageClass("VoidDefaultASTVisitor"))
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(defaultVisitorName, voidName));

    for (ClassName node : allAstNodes) {
      visitor.addMethod(visitMethod(node, V).addModifiers(Modifier.ABSTRACT).build());
      defaultVisitor.addMethod(
          visitMethod(node, V)
              .addAnnotation(Override.class)
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          visitMethod(node, voidName)
              .addAnnotation(Override.class)
              .addModifiers(Modifier.FINAL)
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    writeType(visitor.build());
    writeType(defaultVisitor.build());
    writeType(voidVisitor.build());
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String getInterfaceName = getASTNodeClassName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> TypeName.get(i).toString().endsWith(getInterfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + getInterfaceName, element);
      return;
    }

    ParameterizedTypeName visitorType = ParameterizedTypeName.get(packageClass("ASTVisitor"), V);
    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(getInterfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(packageClass("ASTNodeInterface"));

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(ParameterSpec.builder(visitorType, "visitor").build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(ParameterSpec.builder(visitorType, "visitor").build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildrenMethodBuilder.addStatement(
          "value = $T.accept($L(), visitor, value)",
          packageClass("ASTNodeUtils"),
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    writeType(typeSpecBuilder.build());
  }

  private boolean checkPackage(TypeElement element) {
    PackageElement pkg = processingEnv.getElementUtils().getPackageOf(element);
    String name = pkg.getQualifiedName().toString();
    if (!targetPackage.isPresent()) {
      targetPackage = Optional.of(name);
    } else if (!targetPackage.get().equals(name)) {
      processingEnv
          .getMessager()
          .printMessage(
              Kind.ERROR,
              String.format(
                  "@ASTNode classes must share one package; found %s and %s",
                  targetPackage.get(), name),
              element);
      return false;
    }
    if (!element.getTypeParameters().isEmpty()) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "@ASTNode classes cannot be generic", element);
      return false;
    }
    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!checkPackage(typeElement)) {
        continue;
      }
      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }
      allAstNodes.add(ClassName.get(typeElement));
    }
  }
}
