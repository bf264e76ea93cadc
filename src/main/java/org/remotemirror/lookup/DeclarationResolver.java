/*
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

package org.remotemirror.lookup;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;
import org.remotemirror.decl.DeclContext;
import org.remotemirror.decl.DeclKind;
import org.remotemirror.decl.Declaration;
import org.remotemirror.decl.ModuleDecl;
import org.remotemirror.demangle.Node;
import org.remotemirror.demangle.SymbolDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves decoded symbol trees to declarations.
 *
 * <p>Ambiguous lookups are treated the same as failed ones: a name that resolves to more than one
 * acceptable declaration resolves to nothing.
 */
public class DeclarationResolver {

  private static final Logger logger = LoggerFactory.getLogger(DeclarationResolver.class);

  private final Directory directory;
  private final @Nullable ImporterBridge importer;
  private final SymbolDecoder decoder;
  private final String foreignModuleName;

  /**
   * @param importer the foreign declaration bridge, or {@code null} if no foreign module is loaded
   * @param foreignModuleName the name of the pseudo-module that foreign declarations are mangled
   *     into
   */
  public DeclarationResolver(
      Directory directory,
      @Nullable ImporterBridge importer,
      SymbolDecoder decoder,
      String foreignModuleName) {
    this.directory = requireNonNull(directory);
    this.importer = importer;
    this.decoder = requireNonNull(decoder);
    this.foreignModuleName = requireNonNull(foreignModuleName);
  }

  /** Returns the module or nominal declaration that the node names, or {@code null}. */
  public @Nullable DeclContext findDeclContext(Node node) {
    switch (node.kind()) {
      case GLOBAL:
      case TYPE_MANGLING:
      case TYPE:
      case DECL_CONTEXT:
        return node.hasChildren() ? findDeclContext(node.firstChild()) : null;

      case MODULE:
        return findModule(node);

      case CLASS:
      case STRUCTURE:
      case ENUM:
      case PROTOCOL:
        return findNominalDeclContext(node);

      default:
        // TODO: resolve types declared in extensions once the directory can enumerate them
        return null;
    }
  }

  private @Nullable DeclContext findNominalDeclContext(Node node) {
    if (node.children().size() < 2) {
      return null;
    }
    DeclKind kind = declKind(node.kind());
    Node declNameNode = node.child(1);

    if (declNameNode.kind() == Node.Kind.LOCAL_DECL_NAME) {
      Node moduleNode = findModuleNode(node);
      if (moduleNode == null) {
        return null;
      }
      ModuleDecl module = findModule(moduleNode);
      if (module == null) {
        return null;
      }
      return directory.lookupLocalType(module, decoder.mangle(node));
    }

    String name;
    String privateDiscriminator = null;
    switch (declNameNode.kind()) {
      case IDENTIFIER:
        name = declNameNode.text();
        break;
      case PRIVATE_DECL_NAME:
        if (declNameNode.children().size() < 2) {
          return null;
        }
        privateDiscriminator = declNameNode.child(0).text();
        name = declNameNode.child(1).text();
        if (privateDiscriminator == null) {
          return null;
        }
        break;
      default:
        return null;
    }
    if (name == null) {
      return null;
    }

    DeclContext dc = findDeclContext(node.child(0));
    if (dc == null) {
      // Foreign declarations are mangled into a pseudo-module with no real declaration context.
      if (privateDiscriminator == null && isForeignModule(node.child(0))) {
        return findForeignNominalTypeDecl(name, kind);
      }
      return null;
    }
    return findNominalTypeDecl(dc, name, privateDiscriminator, kind);
  }

  /**
   * Looks up the unique declaration of the given kind named {@code name} in {@code dc}, ignoring
   * candidates that aren't defined in the context's own module.
   */
  public @Nullable Declaration findNominalTypeDecl(
      DeclContext dc, String name, @Nullable String privateDiscriminator, DeclKind kind) {
    ModuleDecl module = dc.parentModule();
    Declaration result = null;
    for (Declaration candidate : directory.lookupMember(dc, name, privateDiscriminator)) {
      if (candidate.kind() != kind) {
        continue;
      }
      if (!candidate.parentModule().equals(module)) {
        continue;
      }
      if (result != null) {
        logger.debug("ambiguous lookup of {} {} in {}", kind, name, dc);
        return null;
      }
      result = candidate;
    }
    return result;
  }

  /**
   * Looks up the unique foreign declaration of the given kind named {@code name}. If two distinct
   * declarations match, the lookup fails even if one of them would have been acceptable.
   */
  public @Nullable Declaration findForeignNominalTypeDecl(String name, DeclKind kind) {
    if (importer == null) {
      return null;
    }
    Declaration result = null;
    for (Declaration candidate : importer.lookupValue(name)) {
      if (candidate.kind() != kind || candidate.equals(result)) {
        continue;
      }
      if (result != null) {
        logger.debug("ambiguous foreign lookup of {} {}", kind, name);
        return null;
      }
      result = candidate;
    }
    return result;
  }

  /** Returns the loaded module with the given name, or {@code null}. */
  public @Nullable ModuleDecl findModule(String name) {
    return directory.lookupModule(name);
  }

  private @Nullable ModuleDecl findModule(Node node) {
    String name = node.text();
    return name != null ? findModule(name) : null;
  }

  private static @Nullable Node findModuleNode(Node node) {
    if (node.kind() == Node.Kind.MODULE) {
      return node;
    }
    if (!node.hasChildren()) {
      return null;
    }
    Node child = node.firstChild();
    switch (child.kind()) {
      case MODULE:
      case DECL_CONTEXT:
      case CLASS:
      case STRUCTURE:
      case ENUM:
      case PROTOCOL:
        return findModuleNode(child);
      default:
        return null;
    }
  }

  private boolean isForeignModule(Node node) {
    if (node.kind() == Node.Kind.DECL_CONTEXT) {
      return node.hasChildren() && isForeignModule(node.firstChild());
    }
    return node.kind() == Node.Kind.MODULE && foreignModuleName.equals(node.text());
  }

  /** Maps a nominal node kind to the declaration kind it denotes. */
  public static DeclKind declKind(Node.Kind kind) {
    switch (kind) {
      case CLASS:
        return DeclKind.CLASS;
      case STRUCTURE:
        return DeclKind.STRUCT;
      case ENUM:
        return DeclKind.ENUM;
      case PROTOCOL:
        return DeclKind.PROTOCOL;
      default:
        throw new IllegalArgumentException("not a nominal node kind: " + kind);
    }
  }
}
